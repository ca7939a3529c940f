package com.lntracker;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries of the ingestion engine.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.lntracker");
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.lntracker.common..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..ingestion..", "..config..");
        rule.check(classes);
    }

    @Test
    void domain_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.lntracker.domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion..", "..config..");
        rule.check(classes);
    }

    @Test
    void stream_and_pagination_must_not_know_lnd_or_storage() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("..ingestion.stream..", "..ingestion.pagination..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "..ingestion.adapter.lnd..", "..ingestion.tracker..", "..ingestion.store..", "..ingestion.job..");
        rule.check(classes);
    }

    @Test
    void store_must_not_depend_on_trackers_or_jobs() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion.store..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion.tracker..", "..ingestion.job..");
        rule.check(classes);
    }

    @Test
    void trackers_must_not_depend_on_job_triggers() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion.tracker..")
                .should().dependOnClassesThat().resideInAPackage("..ingestion.job..");
        rule.check(classes);
    }

    @Test
    void app_config_must_not_depend_on_ingestion() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.lntracker.config..")
                .should().dependOnClassesThat().resideInAPackage("..ingestion..");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.lntracker.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}

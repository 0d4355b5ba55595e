package com.lelantos;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: common and domain are leaves, tracker knows nothing of analysis, only api knows about HTTP
 * controllers.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.lelantos");
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..common..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..tracker..", "..analysis..", "..api..", "..config..");
        rule.check(classes);
    }

    @Test
    void domain_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..tracker..", "..analysis..", "..api..", "..config..");
        rule.check(classes);
    }

    @Test
    void tracker_must_not_depend_on_analysis_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..tracker..")
                .should().dependOnClassesThat().resideInAnyPackage("..analysis..", "..api..");
        rule.check(classes);
    }

    @Test
    void analysis_must_not_depend_on_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..analysis..")
                .should().dependOnClassesThat().resideInAPackage("..api..");
        rule.check(classes);
    }

    @Test
    void analysis_must_not_depend_on_http_client() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..analysis..")
                .should().dependOnClassesThat().haveSimpleNameStartingWith("WebClient");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.lelantos.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}

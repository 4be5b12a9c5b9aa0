package io.datamap.arch;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

class ArchitectureTest {

    @Test
    void coreShouldNotDependOnOtherPackages() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.datamap.core..")
                .should().dependOnClassesThat()
                .resideInAnyPackage("io.datamap.index..", "io.datamap.storage..");
        rule.check(importedMainClasses());
    }

    @Test
    void indexShouldNotDependOnStorage() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("io.datamap.index..")
                .should().dependOnClassesThat().resideInAPackage("io.datamap.storage..");
        rule.check(importedMainClasses());
    }

    @Test
    void onlyStorageShouldLog() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("io.datamap.core..", "io.datamap.index..")
                .should().dependOnClassesThat().resideInAPackage("org.slf4j..");
        rule.check(importedMainClasses());
    }

    @Test
    void mainCodeShouldNotDependOnTestPackages() {
        ArchRule rule = noClasses()
                .should().dependOnClassesThat().resideInAnyPackage("..logging..", "org.junit..", "org.assertj..");
        rule.check(importedMainClasses());
    }

    private static JavaClasses importedMainClasses() {
        return new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("io.datamap..");
    }
}

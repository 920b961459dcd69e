package com.statuswatch.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests for the package layering.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Status parsing and process results are leaves</li>
 *   <li>The wait engine never reaches the simulator or the client</li>
 *   <li>The simulator knows nothing of waiting</li>
 *   <li>Exceptions are unchecked</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(new ImportOption.DoNotIncludeTests())
            .importPackages("com.statuswatch.core");
    }

    @Test
    void status_shouldNotDependOnOtherLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.status..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.wait..", "..core.fake..", "..core.client..", "..core.config..", "..core.process..");

        rule.check(classes);
    }

    @Test
    void process_shouldNotDependOnOtherLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.process..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.status..", "..core.wait..", "..core.fake..", "..core.client..", "..core.config..");

        rule.check(classes);
    }

    @Test
    void report_shouldBeStandalone() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.report..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.status..", "..core.wait..", "..core.fake..", "..core.client..", "..core.config..");

        rule.check(classes);
    }

    /**
     * The wait engine only sees status documents through a status source.
     */
    @Test
    void wait_shouldNotDependOnSimulatorOrClient() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.wait..")
            .should().dependOnClassesThat().resideInAnyPackage("..core.fake..", "..core.client..", "..core.config..");

        rule.check(classes);
    }

    @Test
    void fake_shouldNotDependOnWaitOrClient() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.fake..")
            .should().dependOnClassesThat().resideInAnyPackage("..core.wait..", "..core.client..", "..core.config..");

        rule.check(classes);
    }

    @Test
    void config_shouldNotDependOnClient() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.config..")
            .should().dependOnClassesThat().resideInAnyPackage("..core.client..", "..core.fake..");

        rule.check(classes);
    }

    @Test
    void configClasses_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..core.config..")
            .and().haveSimpleNameEndingWith("Config")
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void exceptions_shouldBeUnchecked() {
        ArchRule rule = classes()
            .that().haveSimpleNameEndingWith("Exception")
            .should().beAssignableTo(RuntimeException.class);

        rule.check(classes);
    }
}

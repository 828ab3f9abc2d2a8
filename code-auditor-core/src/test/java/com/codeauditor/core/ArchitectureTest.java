package com.codeauditor.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * ArchUnit tests for the layering of the core module.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Analyzers and parsers extend their base classes</li>
 *   <li>Implementations are grouped by ecosystem</li>
 *   <li>Domain models are immutable records</li>
 *   <li>Only the store package talks to JDBC</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.codeauditor.core");
    }

    @Test
    void tools_shouldExtendAbstractAnalyzerTool() {
        ArchRule rule = classes()
            .that().resideInAPackage("..tool.impl..")
            .and().haveSimpleNameEndingWith("Tool")
            .should().beAssignableTo("com.codeauditor.core.tool.AbstractAnalyzerTool");

        rule.check(classes);
    }

    @Test
    void parsers_shouldExtendAbstractFindingParser() {
        ArchRule rule = classes()
            .that().resideInAPackage("..convert.impl..")
            .and().haveSimpleNameEndingWith("Parser")
            .should().beAssignableTo("com.codeauditor.core.convert.AbstractFindingParser");

        rule.check(classes);
    }

    /**
     * Verifies implementations are organized by ecosystem (python, javascript, polyglot).
     */
    @Test
    void implementations_shouldBeInEcosystemPackages() {
        ArchRule rule = classes()
            .that().resideInAnyPackage("..tool.impl..", "..convert.impl..")
            .should().resideInAnyPackage("..impl.python..", "..impl.javascript..", "..impl.polyglot..");

        rule.check(classes);
    }

    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnOtherLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..tool..", "..convert..", "..store..", "..audit..", "..registry..", "..config..");

        rule.check(classes);
    }

    /**
     * Verifies JDBC access stays inside the store package, so workers never reach the database.
     */
    @Test
    void onlyStore_shouldUseJdbc() {
        ArchRule rule = noClasses()
            .that().resideOutsideOfPackage("..store..")
            .should().dependOnClassesThat().resideInAPackage("java.sql..");

        rule.check(classes);
    }

    @Test
    void utilClasses_shouldNotDependOnAnalyzers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage("..tool..", "..convert..", "..store..");

        rule.check(classes);
    }
}

package dev.ecodata.architecture;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

@AnalyzeClasses(packages = "dev.ecodata", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

    // Pipeline packages should not depend on adapter packages.
    @ArchTest
    static final ArchRule features_should_not_depend_on_adapters =
        noClasses().that().resideInAnyPackage(
                "..text..", "..extraction..", "..prompt..", "..llm..",
                "..feedback..", "..job..", "..review.."
            )
            .should().dependOnClassesThat().resideInAnyPackage(
                "..mcp..", "..api..", "..config.."
            );

    // The sentence and parsing core knows nothing about models or jobs.
    @ArchTest
    static final ArchRule parsing_core_is_provider_agnostic =
        noClasses().that().resideInAnyPackage("..text..", "..extraction..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..llm..", "..job..", "..feedback..", "dev.langchain4j.."
            );

    // Adapter packages should not depend on each other
    @ArchTest
    static final ArchRule adapters_should_not_depend_on_each_other =
        noClasses().that().resideInAPackage("..mcp..")
            .should().dependOnClassesThat().resideInAPackage("..api..");

    // Config package should not depend on adapter packages
    @ArchTest
    static final ArchRule config_should_not_depend_on_adapters =
        noClasses().that().resideInAPackage("..config..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..mcp..", "..api.."
            );

    // No cyclic dependencies between top-level packages
    @ArchTest
    static final ArchRule no_package_cycles =
        slices().matching("dev.ecodata.(*)..").should().beFreeOfCycles();
}

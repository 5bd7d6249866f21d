package dev.bulletin.architecture;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

@AnalyzeClasses(packages = "dev.bulletin", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

    // The search core never reaches into its HTTP or MCP adapters.
    @ArchTest
    static final ArchRule features_should_not_depend_on_adapters =
        noClasses().that().resideInAnyPackage(
                "..text..", "..synonym..", "..date..", "..document..",
                "..snapshot..", "..query..", "..search..", "..snippet.."
            )
            .should().dependOnClassesThat().resideInAnyPackage(
                "..mcp..", "..api.."
            );

    @ArchTest
    static final ArchRule adapters_should_not_depend_on_each_other =
        noClasses().that().resideInAPackage("..mcp..")
            .should().dependOnClassesThat().resideInAPackage("..api..");

    @ArchTest
    static final ArchRule config_should_not_depend_on_adapters =
        noClasses().that().resideInAPackage("..config..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..mcp..", "..api.."
            );

    // Text normalization sits at the bottom of the graph.
    @ArchTest
    static final ArchRule text_depends_on_no_other_feature =
        noClasses().that().resideInAPackage("dev.bulletin.text..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "dev.bulletin.synonym..", "dev.bulletin.date..", "dev.bulletin.document..",
                "dev.bulletin.snapshot..", "dev.bulletin.query..", "dev.bulletin.search..",
                "dev.bulletin.snippet.."
            );

    @ArchTest
    static final ArchRule no_package_cycles =
        slices().matching("dev.bulletin.(*)..").should().beFreeOfCycles();
}

package org.opwire.arch;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(packages = "org.opwire", importOptions = ImportOption.DoNotIncludeTests.class)
class PackageLayeringGuardTest {
    @ArchTest
    static final ArchRule wire_does_not_depend_on_client_or_obs = noClasses()
            .that()
            .resideInAPackage("org.opwire.wire..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("org.opwire.client..", "org.opwire.obs..");

    @ArchTest
    static final ArchRule obs_does_not_depend_on_client = noClasses()
            .that()
            .resideInAPackage("org.opwire.obs..")
            .should()
            .dependOnClassesThat()
            .resideInAPackage("org.opwire.client..");
}

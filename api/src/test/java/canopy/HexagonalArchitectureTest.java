package canopy;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import com.tngtech.archunit.lang.syntax.ArchRuleDefinition;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

@DisplayName("Hexagonal Architecture Rules")
class HexagonalArchitectureTest {

    private static JavaClasses importedClasses;

    @BeforeAll
    static void setUp() {
        importedClasses = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("canopy");
    }

    @Nested
    @DisplayName("Core Layer Rules")
    class CoreLayerRules {

        @Test
        @DisplayName("Core should not depend on adapter")
        void coreShouldNotDependOnAdapter() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("canopy.core..")
                    .should().dependOnClassesThat().resideInAPackage("canopy.adapter..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Core should not depend on application wiring")
        void coreShouldNotDependOnWiring() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("canopy.core..")
                    .should().dependOnClassesThat().resideInAPackage("canopy.config..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Core should not depend on the HTTP stack")
        void coreShouldNotDependOnHttp() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("canopy.core..")
                    .should().dependOnClassesThat().resideInAnyPackage("io.vertx..", "jakarta.ws.rs..");

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("Adapter Layer Rules")
    class AdapterLayerRules {

        @Test
        @DisplayName("Inbound adapters should not depend on outbound adapters")
        void inboundShouldNotDependOnOutbound() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("canopy.adapter.in..")
                    .should().dependOnClassesThat().resideInAPackage("canopy.adapter.out..");

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("Port Interface Rules")
    class PortInterfaceRules {

        @Test
        @DisplayName("Outbound ports should only contain interfaces")
        void outboundPortsShouldBeInterfaces() {
            ArchRule rule = ArchRuleDefinition.classes()
                    .that().resideInAPackage("canopy.core.port.out..")
                    .should().beInterfaces();

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Inbound ports should only contain interfaces")
        void inboundPortsShouldBeInterfaces() {
            ArchRule rule = ArchRuleDefinition.classes()
                    .that().resideInAPackage("canopy.core.port.in..")
                    .should().beInterfaces();

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("Model Rules")
    class ModelRules {

        @Test
        @DisplayName("Models should not depend on services")
        void modelsShouldNotDependOnServices() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("canopy.core.model..")
                    .should().dependOnClassesThat().resideInAPackage("canopy.core.service..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Models should not depend on ports")
        void modelsShouldNotDependOnPorts() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("canopy.core.model..")
                    .should().dependOnClassesThat().resideInAPackage("canopy.core.port..");

            rule.check(importedClasses);
        }
    }
}

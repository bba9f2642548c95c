package pacer;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
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
                .importPackages("pacer");
    }

    @Nested
    @DisplayName("Core Layer Rules")
    class CoreLayerRules {

        @Test
        @DisplayName("Core should not depend on adapter")
        void coreShouldNotDependOnAdapter() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("pacer.core..")
                    .should().dependOnClassesThat().resideInAPackage("pacer.adapter..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Core should not depend on spi")
        void coreShouldNotDependOnSpi() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("pacer.core..")
                    .should().dependOnClassesThat().resideInAPackage("pacer.spi..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Core should not depend on storage drivers")
        void coreShouldNotDependOnDrivers() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("pacer.core..")
                    .should().dependOnClassesThat().resideInAnyPackage("com.datastax..", "org.sqlite..", "java.sql..");

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("SPI Layer Rules")
    class SpiLayerRules {

        @Test
        @DisplayName("SPI should not depend on adapter")
        void spiShouldNotDependOnAdapter() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("pacer.spi..")
                    .should().dependOnClassesThat().resideInAPackage("pacer.adapter..");

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("Adapter Layer Rules")
    class AdapterLayerRules {

        @Test
        @DisplayName("Backends should not depend on each other")
        void backendsShouldBeIndependent() {
            noClasses()
                    .that().resideInAPackage("pacer.adapter.out.ratelimit.sqlite..")
                    .should().dependOnClassesThat().resideInAnyPackage(
                            "pacer.adapter.out.ratelimit.cassandra..", "pacer.adapter.out.ratelimit.memory..")
                    .check(importedClasses);

            noClasses()
                    .that().resideInAPackage("pacer.adapter.out.ratelimit.cassandra..")
                    .should().dependOnClassesThat().resideInAnyPackage(
                            "pacer.adapter.out.ratelimit.sqlite..", "pacer.adapter.out.ratelimit.memory..")
                    .check(importedClasses);
        }
    }
}

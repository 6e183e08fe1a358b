package com.keystone.verification;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Structural checks on the multi-module layout. Maven runs these with the working directory set to
 * {@code build-tools/verification}.
 */
@DisplayName("Repository structure")
class RepositoryStructureTest {

    private static final List<String> MODULES = List.of(
            "libs/observability", "libs/database", "services/api-server", "build-tools/verification");

    private static Path projectRoot;

    @BeforeAll
    static void resolveProjectRoot() {
        projectRoot = Path.of(System.getProperty("user.dir")).getParent().getParent();

        assertThat(projectRoot.resolve("pom.xml"))
                .as("Root pom.xml must exist at project root: %s", projectRoot)
                .exists();
    }

    @Nested
    @DisplayName("root")
    class Root {

        @Test
        @DisplayName("root POM declares every module")
        void rootPomDeclaresModules() throws IOException {
            String rootPom = Files.readString(projectRoot.resolve("pom.xml"));

            for (String module : MODULES) {
                assertThat(rootPom).contains("<module>" + module + "</module>");
            }
        }

        @Test
        @DisplayName("root POM pins Java 17")
        void javaRelease() throws IOException {
            String rootPom = Files.readString(projectRoot.resolve("pom.xml"));

            assertThat(rootPom).contains("<maven.compiler.release>17</maven.compiler.release>");
        }

        @Test
        @DisplayName("README.md exists")
        void readmeExists() {
            assertThat(projectRoot.resolve("README.md")).exists().isRegularFile();
        }

        @Test
        @DisplayName("the build is Maven only")
        void noOtherBuildTools() {
            assertThat(projectRoot.resolve("build.gradle")).doesNotExist();
            assertThat(projectRoot.resolve("settings.gradle")).doesNotExist();
            assertThat(projectRoot.resolve("build.xml")).doesNotExist();
        }
    }

    @Nested
    @DisplayName("modules")
    class Modules {

        @ParameterizedTest(name = "{0} has a pom.xml")
        @ValueSource(strings = {
            "libs/observability", "libs/database", "services/api-server", "build-tools/verification"
        })
        void modulePomExists(String module) {
            assertThat(projectRoot.resolve(module).resolve("pom.xml")).exists().isRegularFile();
        }

        @ParameterizedTest(name = "{0} keeps sources under com.keystone")
        @ValueSource(strings = {"libs/observability", "libs/database", "services/api-server"})
        void sourcesUnderBasePackage(String module) {
            assertThat(projectRoot.resolve(module).resolve("src/main/java/com/keystone"))
                    .exists()
                    .isDirectory();
        }

        @Test
        @DisplayName("the API server declares both libraries")
        void apiServerUsesLibraries() throws IOException {
            String pom = Files.readString(projectRoot.resolve("services/api-server/pom.xml"));

            assertThat(pom).contains("<artifactId>keystone-observability</artifactId>");
            assertThat(pom).contains("<artifactId>keystone-database</artifactId>");
        }
    }
}

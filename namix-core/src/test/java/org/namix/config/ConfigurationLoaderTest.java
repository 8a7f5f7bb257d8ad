package org.namix.config;

import org.namix.options.NamixOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigurationLoaderTest {

    private static final String YAML = """
        profiles:
          dev:
            naming:
              convention: upper_snake_case
              maxLength: 30
          prod:
            naming:
              convention: snake_case
              locale: tr-TR
            model:
              defaultSchema: sales
        """;

    @Test
    @DisplayName("설정 파일이 없으면 기본값을 반환한다")
    void loadConfiguration_noFile_returnsDefaults(@TempDir Path tempDir) {
        // given
        ConfigurationLoader loader = new ConfigurationLoader(tempDir, name -> null);

        // when
        Map<String, String> config = loader.loadConfiguration("dev");

        // then
        assertEquals(NamixOptions.Naming.CONVENTION_DEFAULT, config.get(NamixOptions.Naming.CONVENTION_KEY));
        assertEquals(NamixOptions.Naming.LOCALE_DEFAULT, config.get(NamixOptions.Naming.LOCALE_KEY));
        assertEquals(String.valueOf(NamixOptions.Naming.MAX_LENGTH_DEFAULT),
                     config.get(NamixOptions.Naming.MAX_LENGTH_KEY));
        assertNull(config.get(NamixOptions.Model.DEFAULT_SCHEMA_KEY));
    }

    @Test
    @DisplayName("설정 파일에서 지정된 프로파일의 값을 로드한다")
    void loadConfiguration_withProfile_loadsCorrectValues(@TempDir Path tempDir) throws IOException {
        // given
        Files.writeString(tempDir.resolve("namix.yaml"), YAML);
        ConfigurationLoader loader = new ConfigurationLoader(tempDir, name -> null);

        // when
        Map<String, String> devConfig = loader.loadConfiguration("dev");
        Map<String, String> prodConfig = loader.loadConfiguration("prod");

        // then
        assertEquals("upper_snake_case", devConfig.get(NamixOptions.Naming.CONVENTION_KEY));
        assertEquals("30", devConfig.get(NamixOptions.Naming.MAX_LENGTH_KEY));
        assertEquals(NamixOptions.Naming.LOCALE_DEFAULT, devConfig.get(NamixOptions.Naming.LOCALE_KEY));

        assertEquals("snake_case", prodConfig.get(NamixOptions.Naming.CONVENTION_KEY));
        assertEquals("tr-TR", prodConfig.get(NamixOptions.Naming.LOCALE_KEY));
        assertEquals("sales", prodConfig.get(NamixOptions.Model.DEFAULT_SCHEMA_KEY));
        assertEquals(String.valueOf(NamixOptions.Naming.MAX_LENGTH_DEFAULT),
                     prodConfig.get(NamixOptions.Naming.MAX_LENGTH_KEY));
    }

    @Test
    @DisplayName("상위 디렉토리의 설정 파일을 찾는다")
    void loadConfiguration_parentDirectory(@TempDir Path tempDir) throws IOException {
        // given
        Files.writeString(tempDir.resolve("namix.yaml"), YAML);
        Path nested = Files.createDirectories(tempDir.resolve("a").resolve("b"));
        ConfigurationLoader loader = new ConfigurationLoader(nested, name -> null);

        // when
        Map<String, String> config = loader.loadConfiguration("dev");

        // then
        assertEquals("30", config.get(NamixOptions.Naming.MAX_LENGTH_KEY));
    }

    @Test
    @DisplayName("존재하지 않는 프로파일을 요청하면 기본값을 반환한다")
    void loadConfiguration_nonExistentProfile_returnsDefaults(@TempDir Path tempDir) throws IOException {
        // given
        Files.writeString(tempDir.resolve("namix.yaml"), YAML);
        ConfigurationLoader loader = new ConfigurationLoader(tempDir, name -> null);

        // when
        Map<String, String> config = loader.loadConfiguration("nonexistent");

        // then
        assertEquals(NamixOptions.Naming.CONVENTION_DEFAULT, config.get(NamixOptions.Naming.CONVENTION_KEY));
        assertEquals(String.valueOf(NamixOptions.Naming.MAX_LENGTH_DEFAULT),
                     config.get(NamixOptions.Naming.MAX_LENGTH_KEY));
    }

    @Test
    @DisplayName("잘못된 YAML 은 경고 후 기본값으로 대체된다")
    void loadConfiguration_malformedYaml_returnsDefaults(@TempDir Path tempDir) throws IOException {
        // given
        Files.writeString(tempDir.resolve("namix.yaml"), "profiles: [unclosed");
        ConfigurationLoader loader = new ConfigurationLoader(tempDir, name -> null);

        // when
        Map<String, String> config = loader.loadConfiguration("dev");

        // then
        assertEquals(NamixOptions.Naming.CONVENTION_DEFAULT, config.get(NamixOptions.Naming.CONVENTION_KEY));
    }

    @Test
    @DisplayName("환경변수로 프로파일을 지정할 수 있다")
    void loadConfiguration_envVariable_usesCorrectProfile(@TempDir Path tempDir) throws IOException {
        // given
        Files.writeString(tempDir.resolve("namix.yaml"), YAML);
        Map<String, String> env = Map.of(NamixOptions.Profile.ENV_VAR, "prod");
        ConfigurationLoader loader = new ConfigurationLoader(tempDir, env::get);

        // when
        Map<String, String> config = loader.loadConfiguration(null);

        // then
        assertEquals("sales", config.get(NamixOptions.Model.DEFAULT_SCHEMA_KEY));
    }

    @Test
    @DisplayName("프로파일 우선순위: CLI > 환경변수 > 기본값")
    void resolveActiveProfile_precedence(@TempDir Path tempDir) {
        ConfigurationLoader withEnv = new ConfigurationLoader(tempDir, name -> "staging");
        ConfigurationLoader withoutEnv = new ConfigurationLoader(tempDir, name -> null);

        assertEquals("prod", withEnv.resolveActiveProfile("prod"));
        assertEquals("staging", withEnv.resolveActiveProfile(null));
        assertEquals("staging", withEnv.resolveActiveProfile("  "));
        assertEquals(NamixOptions.Profile.DEFAULT, withoutEnv.resolveActiveProfile(null));
    }
}

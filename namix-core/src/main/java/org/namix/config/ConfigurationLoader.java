package org.namix.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.namix.options.NamixOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

public class ConfigurationLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);

    private static final String CONFIG_FILE_NAME = NamixOptions.Profile.CONFIG_FILE;
    private static final String DEFAULT_PROFILE = NamixOptions.Profile.DEFAULT;
    private static final String PROFILE_ENV_VAR = NamixOptions.Profile.ENV_VAR;

    private final ObjectMapper yamlMapper;
    private final Path startDirectory;
    private final Function<String, String> environment;

    public ConfigurationLoader() {
        this(Paths.get("").toAbsolutePath());
    }

    public ConfigurationLoader(Path startDirectory) {
        this(startDirectory, System::getenv);
    }

    ConfigurationLoader(Path startDirectory, Function<String, String> environment) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.startDirectory = startDirectory;
        this.environment = environment;
    }

    /**
     * 설정을 로드하고 지정된 프로파일을 적용
     *
     * 우선순위: CLI 프로파일 > 환경변수 > 기본값(dev)
     *
     * @param cliProfile CLI에서 지정된 프로파일 (null 가능)
     * @return 해석된 설정 맵
     */
    public Map<String, String> loadConfiguration(String cliProfile) {
        String activeProfile = resolveActiveProfile(cliProfile);

        Optional<NamixConfiguration> config = findAndLoadConfiguration();
        if (config.isEmpty()) {
            return createDefaultConfiguration();
        }

        return extractConfigurationForProfile(config.get(), activeProfile);
    }

    /**
     * 활성 프로파일을 결정합니다.
     */
    String resolveActiveProfile(String cliProfile) {
        if (cliProfile != null && !cliProfile.trim().isEmpty()) {
            return cliProfile;
        }

        String envProfile = environment.apply(PROFILE_ENV_VAR);
        if (envProfile != null && !envProfile.trim().isEmpty()) {
            return envProfile;
        }

        return DEFAULT_PROFILE;
    }

    /**
     * 시작 디렉토리부터 상위 디렉토리로 올라가며 namix.yaml을 찾습니다.
     */
    private Optional<NamixConfiguration> findAndLoadConfiguration() {
        Path currentDir = startDirectory;

        while (currentDir != null) {
            Path configFile = currentDir.resolve(CONFIG_FILE_NAME);
            if (Files.exists(configFile)) {
                try {
                    NamixConfiguration config = yamlMapper.readValue(configFile.toFile(), NamixConfiguration.class);
                    log.debug("Loaded configuration from {}", configFile);
                    return Optional.ofNullable(config);
                } catch (IOException e) {
                    log.warn("Failed to parse {}: {}", configFile, e.getMessage());
                    return Optional.empty();
                }
            }
            currentDir = currentDir.getParent();
        }

        return Optional.empty();
    }

    /**
     * 특정 프로파일의 설정을 추출하여 키-값 맵으로 변환합니다.
     */
    private Map<String, String> extractConfigurationForProfile(NamixConfiguration config, String profile) {
        var profileConfig = config.getProfiles() == null ? null : config.getProfiles().get(profile);
        if (profileConfig == null) {
            log.warn("Profile '{}' not found in configuration. Using defaults.", profile);
            return createDefaultConfiguration();
        }

        var configMap = new HashMap<>(createDefaultConfiguration());

        var naming = profileConfig.getNaming();
        if (naming != null) {
            putIfPresent(configMap, NamixOptions.Naming.CONVENTION_KEY, naming.getConvention());
            putIfPresent(configMap, NamixOptions.Naming.LOCALE_KEY, naming.getLocale());
            if (naming.getMaxLength() != null) {
                configMap.put(NamixOptions.Naming.MAX_LENGTH_KEY, String.valueOf(naming.getMaxLength()));
            }
        }

        var model = profileConfig.getModel();
        if (model != null) {
            putIfPresent(configMap, NamixOptions.Model.DEFAULT_SCHEMA_KEY, model.getDefaultSchema());
        }

        return configMap;
    }

    private static void putIfPresent(Map<String, String> configMap, String key, String value) {
        if (value != null && !value.isBlank()) {
            configMap.put(key, value.trim());
        }
    }

    /**
     * 기본 설정 맵을 생성합니다.
     */
    private Map<String, String> createDefaultConfiguration() {
        return Map.of(
            NamixOptions.Naming.CONVENTION_KEY, NamixOptions.Naming.CONVENTION_DEFAULT,
            NamixOptions.Naming.LOCALE_KEY, NamixOptions.Naming.LOCALE_DEFAULT,
            NamixOptions.Naming.MAX_LENGTH_KEY, String.valueOf(NamixOptions.Naming.MAX_LENGTH_DEFAULT)
        );
    }
}

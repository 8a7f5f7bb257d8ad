package org.namix.cli;

import ch.qos.logback.classic.Level;
import org.namix.cli.definition.ModelDefinition;
import org.namix.cli.report.NamingReport;
import org.namix.cli.report.NamingReportBuilder;
import org.namix.cli.service.ModelDefinitionIoService;
import org.namix.cli.service.ModelDefinitionIoService.Format;
import org.namix.cli.service.ModelReplayService;
import org.namix.config.ConfigurationLoader;
import org.namix.config.NamingSettings;
import org.namix.model.SchemaModel;
import org.namix.naming.NamingConvention;
import org.namix.options.NamixOptions;
import org.namix.validation.ModelValidationException;
import org.namix.validation.ModelValidator;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Replays a model definition with the naming engine attached and prints the physical names.
 */
@CommandLine.Command(
        name = "rewrite",
        mixinStandardHelpOptions = true,
        showDefaultValues = true,
        description = "모델 정의를 재생하여 네이밍 컨벤션이 적용된 물리 이름을 출력합니다."
)
public class RewriteCommand implements Callable<Integer> {

    @CommandLine.Option(names = {"-m", "--model"}, required = true, description = "모델 정의 YAML 파일")
    private Path modelFile;
    @CommandLine.Option(names = {"-c", "--convention"}, converter = NamingConventionConverter.class,
            description = "적용할 네이밍 컨벤션 (snake_case, lower_case, upper_case, upper_snake_case, camel_case, none). 설정 파일보다 우선합니다.")
    private NamingConvention convention;
    @CommandLine.Option(names = "--profile", description = "사용할 설정 프로파일 (dev, prod, test 등)")
    private String profile;
    @CommandLine.Option(names = "--config-dir", description = "namix.yaml 탐색을 시작할 디렉토리", defaultValue = ".")
    private Path configDir;
    @CommandLine.Option(names = {"-f", "--format"}, converter = FormatConverter.class, description = "출력 형식 (json, yaml)", defaultValue = "json")
    private Format format;
    @CommandLine.Option(names = {"-o", "--out"}, description = "리포트 저장 위치 (생략 시 표준 출력)")
    private Path out;
    @CommandLine.Option(names = "--verbose", description = "네이밍 결정 과정을 DEBUG 로그로 출력합니다.")
    private boolean verbose;

    private final ModelDefinitionIoService ioService = new ModelDefinitionIoService();
    private final ModelReplayService replayService = new ModelReplayService();
    private final ModelValidator validator = new ModelValidator();
    private final NamingReportBuilder reportBuilder = new NamingReportBuilder();

    @Override
    public Integer call() {
        if (verbose) {
            enableDebugLogging();
        }
        try {
            NamingSettings settings = resolveSettings();
            ModelDefinition definition = ioService.loadDefinition(modelFile);

            SchemaModel model = replayService.replay(definition, settings);
            validator.validate(model);

            NamingReport report = reportBuilder.build(model, settings.getConvention().displayName());
            String rendered = ioService.render(report, format);
            if (out != null) {
                ioService.write(rendered, out);
                System.out.println("Naming report written to " + out);
            } else {
                System.out.println(rendered);
            }
            return 0;

        } catch (ModelValidationException e) {
            System.err.println("Naming conflicts detected:");
            e.getProblems().forEach(problem -> System.err.println("   - " + problem));
            return 1;
        } catch (IOException e) {
            System.err.println("I/O error: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException | IllegalStateException e) {
            System.err.println("Rewrite failed: " + e.getMessage());
            return 1;
        }
    }

    private NamingSettings resolveSettings() {
        Map<String, String> config = new HashMap<>(new ConfigurationLoader(configDir.toAbsolutePath()).loadConfiguration(profile));
        if (convention != null) {
            config.put(NamixOptions.Naming.CONVENTION_KEY, convention.name());
        }
        return NamingSettings.fromConfiguration(config);
    }

    private static void enableDebugLogging() {
        if (LoggerFactory.getLogger("org.namix") instanceof ch.qos.logback.classic.Logger logger) {
            logger.setLevel(Level.DEBUG);
        }
    }

    public static class NamingConventionConverter implements CommandLine.ITypeConverter<NamingConvention> {
        @Override
        public NamingConvention convert(String value) {
            return NamingConvention.fromString(value);
        }
    }

    public static class FormatConverter implements CommandLine.ITypeConverter<Format> {
        @Override
        public Format convert(String value) {
            return Format.fromString(value);
        }
    }
}

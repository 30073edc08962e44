package com.ryuqq.monobuild.adapter.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.monobuild.core.config.CommandLineConfiguration;
import com.ryuqq.monobuild.core.config.CommandLineConfigurationOptions;
import com.ryuqq.monobuild.core.config.ConfigurationException;
import com.ryuqq.monobuild.core.config.DefaultCommands;
import com.ryuqq.monobuild.core.config.definition.CommandDefinition;
import com.ryuqq.monobuild.core.config.definition.CommandKind;
import com.ryuqq.monobuild.core.config.definition.CommandLineDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * command-line.json 로더.
 *
 * <p>Jackson으로 {@link CommandLineDefinition} record를 읽은 뒤 {@link CommandLineConfiguration}을 생성합니다.
 * 주석과 후행 쉼표를 허용합니다.</p>
 *
 * <p><strong>두 가지 진입점:</strong></p>
 * <ul>
 *   <li>{@link #tryLoadFromFile(Path)}: 파일이 없으면 empty, 기본 build/rebuild 미포함</li>
 *   <li>{@link #loadFromFileOrDefault(Path)}: 파일이 없으면 기본 설정, build/rebuild 선언에는
 *       기본 선언을 얕게 병합 (저장소 필드 우선)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CommandLineJsonLoader loader = new CommandLineJsonLoader();
 * CommandLineConfiguration configuration =
 *     loader.loadFromFileOrDefault(repoRoot.resolve("common/config/rush/command-line.json"));
 * }</pre>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public final class CommandLineJsonLoader {

    private static final Logger log = LoggerFactory.getLogger(CommandLineJsonLoader.class);

    private final ObjectMapper mapper;
    private final ObjectMapper defaultsMapper;

    public CommandLineJsonLoader() {
        this.mapper = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .build();
        this.defaultsMapper = JsonMapper.builder()
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();
    }

    /**
     * 파일이 있으면 읽고, 기본 build/rebuild 커맨드 없이 설정 생성.
     *
     * @param path command-line.json 경로
     * @return 설정 (파일이 없으면 empty)
     * @throws ConfigurationException 파싱 또는 검증 실패 시
     */
    public Optional<CommandLineConfiguration> tryLoadFromFile(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (!Files.exists(path)) {
            log.debug("Command-line configuration not found: {}", path);
            return Optional.empty();
        }
        CommandLineDefinition definition = read(path, false);
        return Optional.of(CommandLineConfiguration.from(
            definition, CommandLineConfigurationOptions.withoutDefaultBuildCommands()));
    }

    /**
     * 파일을 읽어 기본 build/rebuild를 포함한 설정 생성. 파일이 없으면 기본 설정.
     *
     * @param path command-line.json 경로
     * @return 설정
     * @throws ConfigurationException 파싱 또는 검증 실패 시
     */
    public CommandLineConfiguration loadFromFileOrDefault(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (!Files.exists(path)) {
            log.info("Command-line configuration not found: {}. Using default build commands.", path);
            return CommandLineConfiguration.from(CommandLineDefinition.empty());
        }
        return CommandLineConfiguration.from(read(path, true), CommandLineConfigurationOptions.defaults());
    }

    /**
     * JSON 문자열 파싱 (기본 선언 병합 포함).
     *
     * @param json command-line.json 내용
     * @return 원시 설정
     * @throws ConfigurationException 파싱 실패 시
     */
    public CommandLineDefinition parse(String json) {
        try {
            return toDefinition(mapper.readTree(json), true);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to parse command-line configuration: " + e.getMessage(), e);
        }
    }

    private CommandLineDefinition read(Path path, boolean mergeDefaults) {
        try {
            log.debug("Loading command-line configuration from: {}", path);
            return toDefinition(mapper.readTree(path.toFile()), mergeDefaults);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load " + path + ": " + e.getMessage(), e);
        }
    }

    private CommandLineDefinition toDefinition(JsonNode root, boolean mergeDefaults) throws IOException {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return CommandLineDefinition.empty();
        }
        if (mergeDefaults && root.path("commands").isArray()) {
            ArrayNode commands = (ArrayNode) root.get("commands");
            for (int i = 0; i < commands.size(); i++) {
                if (commands.get(i) instanceof ObjectNode command) {
                    commands.set(i, mergeWithDefault(command));
                }
            }
        }
        return mapper.treeToValue(root, CommandLineDefinition.class);
    }

    /**
     * build/rebuild 선언 위에 기본 선언을 얕게 병합 (저장소 필드 우선).
     */
    private ObjectNode mergeWithDefault(ObjectNode command) {
        CommandKind kind = kindOf(command.path("commandKind").asText(null));
        CommandDefinition defaults = DefaultCommands.defaultFor(kind, command.path("name").asText(null));
        if (defaults == null) {
            return command;
        }
        ObjectNode merged = defaultsMapper.valueToTree(defaults);
        merged.setAll(command);
        log.debug("Merged default \"{}\" command fields into repository declaration", defaults.name());
        return merged;
    }

    private static CommandKind kindOf(String value) {
        for (CommandKind kind : CommandKind.values()) {
            if (kind.jsonValue().equals(value)) {
                return kind;
            }
        }
        return null;
    }
}

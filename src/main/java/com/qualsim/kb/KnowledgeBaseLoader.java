package com.qualsim.kb;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.qualsim.core.constraint.DependencyConstraint;
import com.qualsim.core.model.Action;
import com.qualsim.core.model.AttributePath;
import com.qualsim.core.model.AttributeSpec;
import com.qualsim.core.model.KnowledgeBase;
import com.qualsim.core.model.ObjectType;
import com.qualsim.core.model.ParameterSpec;
import com.qualsim.core.space.QualitativeSpace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads a knowledge base from a YAML/JSON file or from every {@code *.yaml}, {@code *.yml} and
 * {@code *.json} file below a directory, in sorted path order.
 * <p>
 * Each file may contribute {@code spaces}, {@code objects} and {@code actions} sections; the result
 * is validated before it is returned.
 */
@Service
public class KnowledgeBaseLoader {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeBaseLoader.class);

    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final KnowledgeBaseValidator validator;

    public KnowledgeBaseLoader(KnowledgeBaseValidator validator) {
        this.validator = validator;
    }

    /**
     * @param path a knowledge-base file or a directory of them
     * @throws KnowledgeBaseException if a file cannot be read, parsed or does not validate
     */
    public KnowledgeBase load(Path path) {
        List<Path> files = listFiles(path);
        if (files.isEmpty()) {
            throw new KnowledgeBaseException(path.toString(), "no knowledge-base files found");
        }

        Map<String, QualitativeSpace> spaces = new LinkedHashMap<>();
        Map<String, ObjectType> objectTypes = new LinkedHashMap<>();
        List<Action> actions = new ArrayList<>();
        Map<String, String> sources = new LinkedHashMap<>();

        for (Path file : files) {
            String source = file.toString();
            JsonNode root = read(file);
            try {
                readSpaces(root.get("spaces"), spaces, source);
                readObjects(root.get("objects"), objectTypes, sources, source);
                for (Action action : readActions(root.get("actions"))) {
                    actions.add(action);
                    sources.putIfAbsent(KnowledgeBaseValidator.elementKey(action), source);
                }
            } catch (IllegalArgumentException e) {
                throw new KnowledgeBaseException(source, e.getMessage(), e);
            }
        }

        KnowledgeBase kb = new KnowledgeBase(spaces, objectTypes, actions);
        List<KnowledgeBaseValidator.Problem> problems = validator.validate(kb);
        if (!problems.isEmpty()) {
            Set<String> sourceFiles = new LinkedHashSet<>();
            List<String> messages = new ArrayList<>();
            for (KnowledgeBaseValidator.Problem problem : problems) {
                sourceFiles.add(sources.getOrDefault(problem.element(), path.toString()));
                messages.add(problem.element() + ": " + problem.message());
            }
            throw new KnowledgeBaseException(String.join(", ", sourceFiles), messages);
        }

        log.info("Loaded knowledge base from {}: {} spaces, {} object types, {} actions",
                path, spaces.size(), objectTypes.size(), actions.size());
        return kb;
    }

    private List<Path> listFiles(Path path) {
        if (!Files.exists(path)) {
            throw new KnowledgeBaseException(path.toString(), "path does not exist");
        }
        if (!Files.isDirectory(path)) {
            return List.of(path);
        }
        try (Stream<Path> walk = Files.walk(path)) {
            return walk.filter(Files::isRegularFile)
                    .filter(KnowledgeBaseLoader::isKnowledgeBaseFile)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new KnowledgeBaseException(path.toString(), "cannot list directory: " + e.getMessage(), e);
        }
    }

    private static boolean isKnowledgeBaseFile(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml") || name.endsWith(".json");
    }

    private JsonNode read(Path file) {
        ObjectMapper mapper = file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json")
                ? jsonMapper : yamlMapper;
        try {
            JsonNode root = mapper.readTree(file.toFile());
            if (root == null || root.isMissingNode() || root.isNull()) {
                return mapper.createObjectNode();
            }
            if (!root.isObject()) {
                throw new KnowledgeBaseException(file.toString(), "top level must be a mapping");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new KnowledgeBaseException(file.toString(), "malformed content: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new KnowledgeBaseException(file.toString(), "cannot read file: " + e.getMessage(), e);
        }
    }

    private void readSpaces(JsonNode node, Map<String, QualitativeSpace> spaces, String source) {
        if (node == null || node.isNull()) {
            return;
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = it.next();
            String name = entry.getKey();
            if (spaces.containsKey(name)) {
                throw new KnowledgeBaseException(source, "duplicate space '" + name + "'");
            }
            JsonNode levels = entry.getValue().isArray() ? entry.getValue() : entry.getValue().get("levels");
            spaces.put(name, new QualitativeSpace(name, ConditionParser.stringList(levels)));
        }
    }

    private void readObjects(JsonNode node, Map<String, ObjectType> objectTypes,
                             Map<String, String> sources, String source) {
        if (node == null || node.isNull()) {
            return;
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = it.next();
            String name = entry.getKey();
            if (objectTypes.containsKey(name)) {
                throw new KnowledgeBaseException(source, "duplicate object type '" + name + "'");
            }
            ObjectType type = readObjectType(name, entry.getValue());
            objectTypes.put(name, type);
            sources.put(KnowledgeBaseValidator.elementKey(type), source);
        }
    }

    private ObjectType readObjectType(String name, JsonNode node) {
        Map<AttributePath, AttributeSpec> attributes = new LinkedHashMap<>();
        JsonNode parts = node.get("parts");
        if (parts != null) {
            for (Iterator<Map.Entry<String, JsonNode>> it = parts.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> part = it.next();
                readAttributes(part.getKey(), part.getValue().get("attributes"), attributes);
            }
        }
        readAttributes(null, node.get("attributes"), attributes);

        List<DependencyConstraint> constraints = new ArrayList<>();
        JsonNode constraintNodes = node.get("constraints");
        if (constraintNodes != null) {
            for (JsonNode constraint : constraintNodes) {
                String type = constraint.path("type").asText("dependency");
                if (!"dependency".equals(type)) {
                    throw new IllegalArgumentException("Unknown constraint type '" + type + "' on '" + name + "'");
                }
                constraints.add(new DependencyConstraint(
                        ConditionParser.parse(constraint.get("condition")),
                        ConditionParser.parse(constraint.get("requires")),
                        constraint.path("description").asText(null)));
            }
        }
        return new ObjectType(name, attributes, constraints);
    }

    private void readAttributes(String part, JsonNode node, Map<AttributePath, AttributeSpec> into) {
        if (node == null || node.isNull()) {
            return;
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode spec = entry.getValue();
            JsonNode defaultValue = spec.get("default");
            into.put(new AttributePath(part, entry.getKey()), new AttributeSpec(
                    ConditionParser.text(spec, "space"),
                    defaultValue == null || defaultValue.isNull() ? AttributeSpec.UNKNOWN : defaultValue.asText(),
                    spec.path("mutable").asBoolean(true)));
        }
    }

    private List<Action> readActions(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        List<Action> actions = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode action : node) {
                actions.add(readAction(ConditionParser.text(action, "name"), action));
            }
        } else {
            for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> entry = it.next();
                actions.add(readAction(entry.getKey(), entry.getValue()));
            }
        }
        return actions;
    }

    private Action readAction(String name, JsonNode node) {
        List<ParameterSpec> parameters = new ArrayList<>();
        JsonNode parameterNodes = node.get("parameters");
        if (parameterNodes != null) {
            for (JsonNode parameter : parameterNodes) {
                JsonNode defaultValue = parameter.get("default");
                parameters.add(new ParameterSpec(
                        ConditionParser.text(parameter, "name"),
                        parameter.path("required").asBoolean(true),
                        ConditionParser.stringList(parameter.get("choices")),
                        defaultValue == null || defaultValue.isNull() ? null : defaultValue.asText()));
            }
        }
        return new Action(name,
                ConditionParser.text(node, "object_type"),
                parameters,
                ConditionParser.parseList(node.get("preconditions")),
                EffectParser.parseList(node.get("effects")));
    }
}

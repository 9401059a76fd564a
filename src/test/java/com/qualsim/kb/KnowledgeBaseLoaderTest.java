package com.qualsim.kb;

import com.qualsim.core.condition.AttributeCheck;
import com.qualsim.core.condition.ValueRef;
import com.qualsim.core.effect.Conditional;
import com.qualsim.core.effect.SetAttribute;
import com.qualsim.core.engine.NodeStatus;
import com.qualsim.core.engine.TransitionResult;
import com.qualsim.core.model.Action;
import com.qualsim.core.model.AttributePath;
import com.qualsim.core.model.KnowledgeBase;
import com.qualsim.core.model.ObjectType;
import com.qualsim.core.model.SimulationScope;
import com.qualsim.core.model.WorldSnapshot;
import com.qualsim.core.space.Operator;
import com.qualsim.support.Flashlight;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class KnowledgeBaseLoaderTest {

    private static final String SPACES = """
            spaces:
              battery_level: [empty, low, medium, high, full]
              light_state: {levels: [dark, lit]}
            """;

    private static final String OBJECT = """
            objects:
              torch:
                parts:
                  battery:
                    attributes:
                      level: {space: battery_level}
                  bulb:
                    attributes:
                      state: {space: light_state, default: dark}
                attributes:
                  color: {space: light_state, default: dark, mutable: false}
            """;

    @TempDir
    Path tempDir;

    private KnowledgeBaseLoader loader;

    @BeforeEach
    void setUp() {
        loader = new KnowledgeBaseLoader(new KnowledgeBaseValidator());
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Nested
    @DisplayName("loading")
    class Loading {

        @Test
        @DisplayName("loads the flashlight knowledge base")
        void flashlight() throws URISyntaxException {
            KnowledgeBase kb = loader.load(Path.of(getClass().getResource("/kb/flashlight.yaml").toURI()));

            assertEquals(5, kb.spaces().size());
            assertEquals(List.of("empty", "low", "medium", "high", "full"),
                    kb.space("battery_level").orElseThrow().levels());
            ObjectType flashlight = kb.objectType("flashlight").orElseThrow();
            assertEquals(5, flashlight.attributes().size());
            assertFalse(flashlight.attribute(Flashlight.HOUSING).orElseThrow().mutable());
            assertTrue(flashlight.attribute(Flashlight.LEVEL).orElseThrow().defaultsToUnknown());
            assertEquals(1, flashlight.constraints().size());
            assertEquals(7, kb.actionsFor("flashlight").size());
        }

        @Test
        @DisplayName("elif entries nest into the else branch")
        void elif() throws URISyntaxException {
            KnowledgeBase kb = loader.load(Path.of(getClass().getResource("/kb/flashlight.yaml").toURI()));

            Action turnOn = kb.action("flashlight", "turn_on").orElseThrow();
            Conditional conditional = (Conditional) turnOn.effects().get(2);

            assertEquals(2, conditional.chain().cases().size());
            assertTrue(conditional.chain().hasElse());
        }

        @Test
        @DisplayName("loaded knowledge base simulates like the one built in code")
        void sameBehaviour() throws URISyntaxException {
            KnowledgeBase kb = loader.load(Path.of(getClass().getResource("/kb/flashlight.yaml").toURI()));
            SimulationScope scope = new SimulationScope(kb, kb.objectType("flashlight").orElseThrow());

            List<TransitionResult> results = Flashlight.engine().apply(WorldSnapshot.initial(scope, Map.of()),
                    kb.action("flashlight", "turn_on").orElseThrow(), Map.of(), scope);

            assertEquals(List.of(NodeStatus.OK, NodeStatus.OK, NodeStatus.OK, NodeStatus.REJECTED),
                    results.stream().map(TransitionResult::status).toList());
        }

        @Test
        @DisplayName("directory files are merged in sorted order")
        void directory() throws IOException {
            write("a/spaces.yaml", SPACES);
            write("b/torch.yml", OBJECT);
            write("c/actions.json", """
                    {"actions": {"light": {"object_type": "torch",
                      "preconditions": [{"type": "attribute_check", "attribute": "battery.level",
                                         "operator": ">", "value": "empty"}],
                      "effects": [{"type": "set_attribute", "attribute": "bulb.state", "value": "lit"}]}}}
                    """);
            write("notes.txt", "ignored");

            KnowledgeBase kb = loader.load(tempDir);

            Action light = kb.action("torch", "light").orElseThrow();
            AttributeCheck check = (AttributeCheck) light.preconditions().get(0);
            assertEquals(Operator.GREATER_THAN, check.operator());
            assertEquals(ValueRef.level("empty"), check.value());
            assertEquals(AttributePath.global("color"), kb.objectType("torch").orElseThrow()
                    .attributes().keySet().stream().filter(AttributePath::isGlobal).findFirst().orElseThrow());
        }

        @Test
        @DisplayName("parameter references and parameter conditions are parsed")
        void parameters() throws IOException {
            write("kb.yaml", SPACES + OBJECT + """
                    actions:
                      - name: show
                        object_type: torch
                        parameters:
                          - {name: state, choices: [dark, lit], default: lit}
                        preconditions:
                          - {type: parameter_valid, parameter: state, values: [dark, lit]}
                        effects:
                          - {type: set_attribute, attribute: bulb.state, value: $state}
                    """);

            Action show = loader.load(tempDir).action("torch", "show").orElseThrow();

            assertEquals("lit", show.parameters().get(0).defaultValue());
            assertEquals("$state", ((SetAttribute) show.effects().get(0)).value().describe());
        }
    }

    @Nested
    @DisplayName("rejection")
    class Rejection {

        @Test
        @DisplayName("missing path is reported")
        void missingPath() {
            var e = assertThrows(KnowledgeBaseException.class, () -> loader.load(tempDir.resolve("nope")));
            assertTrue(e.getSource().endsWith("nope"));
        }

        @Test
        @DisplayName("empty directory is reported")
        void emptyDirectory() {
            assertThrows(KnowledgeBaseException.class, () -> loader.load(tempDir));
        }

        @Test
        @DisplayName("malformed YAML names the file")
        void malformed() throws IOException {
            Path file = write("broken.yaml", "spaces: [unclosed");

            var e = assertThrows(KnowledgeBaseException.class, () -> loader.load(tempDir));
            assertEquals(file.toString(), e.getSource());
        }

        @Test
        @DisplayName("unknown space reference is a validation problem")
        void unknownSpace() throws IOException {
            write("kb.yaml", SPACES + """
                    objects:
                      torch:
                        attributes:
                          weight: {space: mass, default: light}
                    """);

            var e = assertThrows(KnowledgeBaseException.class, () -> loader.load(tempDir));
            assertTrue(e.getProblems().get(0).contains("unknown space 'mass'"));
            assertTrue(e.getProblems().get(0).startsWith("object:torch"));
        }

        @Test
        @DisplayName("effect on an immutable attribute is a validation problem")
        void immutableWrite() throws IOException {
            write("kb.yaml", SPACES + OBJECT + """
                    actions:
                      - name: paint
                        object_type: torch
                        effects:
                          - {type: set_attribute, attribute: color, value: lit}
                    """);

            var e = assertThrows(KnowledgeBaseException.class, () -> loader.load(tempDir));
            assertTrue(e.getProblems().stream().anyMatch(p -> p.contains("immutable attribute 'color'")));
        }

        @Test
        @DisplayName("level outside the space and undeclared parameters are both reported")
        void severalProblems() throws IOException {
            write("kb.yaml", SPACES + OBJECT + """
                    actions:
                      - name: dazzle
                        object_type: torch
                        preconditions:
                          - {type: attribute_check, attribute: battery.level, operator: gte, value: overcharged}
                        effects:
                          - {type: set_attribute, attribute: bulb.state, value: $mode}
                    """);

            var e = assertThrows(KnowledgeBaseException.class, () -> loader.load(tempDir));
            assertEquals(2, e.getProblems().size());
            assertTrue(e.getMessage().contains("overcharged"));
            assertTrue(e.getMessage().contains("undeclared parameter 'mode'"));
        }

        @Test
        @DisplayName("ordering operator with a list of levels is rejected")
        void operatorArity() throws IOException {
            write("kb.yaml", SPACES + OBJECT + """
                    actions:
                      - name: check_range
                        object_type: torch
                        preconditions:
                          - {type: attribute_check, attribute: battery.level, operator: lt, value: [low, high]}
                    """);

            var e = assertThrows(KnowledgeBaseException.class, () -> loader.load(tempDir));
            assertTrue(e.getProblems().get(0).contains("takes a single level"));
        }

        @Test
        @DisplayName("duplicate actions are rejected")
        void duplicateAction() throws IOException {
            String action = """
                      - name: light
                        object_type: torch
                        effects:
                          - {type: set_attribute, attribute: bulb.state, value: lit}
                    """;
            write("kb.yaml", SPACES + OBJECT + "actions:\n" + action + action);

            var e = assertThrows(KnowledgeBaseException.class, () -> loader.load(tempDir));
            assertTrue(e.getProblems().get(0).contains("duplicate action 'light'"));
        }

        @Test
        @DisplayName("unknown condition type is reported with its file")
        void unknownConditionType() throws IOException {
            Path file = write("kb.yaml", SPACES + OBJECT + """
                    actions:
                      - name: light
                        object_type: torch
                        preconditions:
                          - {type: maybe, attribute: bulb.state}
                    """);

            var e = assertThrows(KnowledgeBaseException.class, () -> loader.load(tempDir));
            assertEquals(file.toString(), e.getSource());
            assertTrue(e.getMessage().contains("maybe"));
        }
    }
}

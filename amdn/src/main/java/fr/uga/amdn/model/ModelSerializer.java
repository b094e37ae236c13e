package fr.uga.amdn.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.uga.amdn.trace.Action;
import fr.uga.amdn.trace.Fluent;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Converts models to and from JSON documents of the shape {@code {"fluents": [...], "actions": [...]}}.
 *
 * <p>Fluents and actions are written in their natural order, so serializing an unchanged model always yields the
 * same text.</p>
 */
public class ModelSerializer {

    private final ObjectMapper mapper;

    public ModelSerializer() {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String serialize(Model model) {
        try {
            return this.mapper.writeValueAsString(toTree(model));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot write the model as JSON", e);
        }
    }

    public String serialize(Model model, Path file) throws IOException {
        String json = serialize(model);
        Files.writeString(file, json, StandardCharsets.UTF_8);
        return json;
    }

    public Model deserialize(String json) throws IOException {
        return fromTree(this.mapper.readTree(json));
    }

    public Model deserialize(Path file) throws IOException {
        return deserialize(Files.readString(file, StandardCharsets.UTF_8));
    }

    private ObjectNode toTree(Model model) {
        ObjectNode root = this.mapper.createObjectNode();
        ArrayNode fluents = root.putArray("fluents");
        for (Fluent fluent : model.getFluents()) {
            fluents.add(fluentNode(fluent));
        }
        ArrayNode actions = root.putArray("actions");
        for (LearnedAction action : model.getActions()) {
            ObjectNode node = actions.addObject();
            node.put("name", action.getAction().getName());
            ArrayNode objects = node.putArray("objects");
            action.getAction().getObjects().forEach(objects::add);
            putFluents(node, "precond", action.getPrecond());
            putFluents(node, "add", action.getAdd());
            putFluents(node, "delete", action.getDelete());
        }
        return root;
    }

    private ObjectNode fluentNode(Fluent fluent) {
        ObjectNode node = this.mapper.createObjectNode();
        node.put("name", fluent.getName());
        ArrayNode objects = node.putArray("objects");
        fluent.getObjects().forEach(objects::add);
        return node;
    }

    private void putFluents(ObjectNode node, String field, Set<Fluent> fluents) {
        ArrayNode array = node.putArray(field);
        for (Fluent fluent : fluents) {
            array.add(fluentNode(fluent));
        }
    }

    private Model fromTree(JsonNode root) throws IOException {
        if (!root.has("fluents") || !root.has("actions")) {
            throw new IOException("A model document needs \"fluents\" and \"actions\"");
        }
        List<Fluent> fluents = readFluents(root.get("fluents"));
        List<LearnedAction> actions = new ArrayList<>();
        for (JsonNode node : root.get("actions")) {
            Action action = new Action(requireText(node, "name"), readStrings(node.path("objects")));
            actions.add(new LearnedAction(action, readFluents(node.path("precond")), readFluents(node.path("add")),
                readFluents(node.path("delete"))));
        }
        return new Model(fluents, actions);
    }

    private List<Fluent> readFluents(JsonNode array) throws IOException {
        List<Fluent> fluents = new ArrayList<>();
        for (JsonNode node : array) {
            fluents.add(new Fluent(requireText(node, "name"), readStrings(node.path("objects"))));
        }
        return fluents;
    }

    private static List<String> readStrings(JsonNode array) {
        List<String> strings = new ArrayList<>();
        for (JsonNode node : array) {
            strings.add(node.asText());
        }
        return strings;
    }

    private static String requireText(JsonNode node, String field) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new IOException("Missing \"" + field + "\" in " + node);
        }
        return value.asText();
    }
}

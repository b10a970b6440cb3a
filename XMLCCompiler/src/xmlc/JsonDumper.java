package xmlc;

import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** Renders tokens and syntax trees as JSON, for {@code --dump}. */
public final class JsonDumper implements ASTVisitor<JsonNode> {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  private JsonDumper() {}

  public static ArrayNode dumpTokens(List<Tokenizer.Token> tokens) {
    ArrayNode array = NODES.arrayNode();
    for (Tokenizer.Token token : tokens) {
      ObjectNode json = array.addObject();
      json.put("data", token.text());
      json.put("type", token.kind().name());
      ObjectNode location = json.putObject("location");
      location.put("file", token.pos().file());
      location.put("line", token.pos().lineNumber() + 1);
      location.put("column", token.pos().column() + 1);
      json.put("depth", token.depth());
    }
    return array;
  }

  public static JsonNode dumpAst(AST.Program program) {
    return program.accept(new JsonDumper(), null);
  }

  public static String render(JsonNode json) {
    try {
      return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(json);
    } catch (JsonProcessingException ex) {
      // Trees built from JsonNodeFactory always serialize.
      throw new IllegalStateException(ex);
    }
  }

  private static ObjectNode wrap(Enum<?> type, ObjectNode fields) {
    ObjectNode json = NODES.objectNode();
    json.set(type.name(), fields);
    return json;
  }

  private ArrayNode dumpAll(List<? extends AST.Node> nodes) {
    ArrayNode array = NODES.arrayNode();
    nodes.forEach(n -> array.add(n.accept(this, null)));
    return array;
  }

  @Override
  public JsonNode visit(AST.Program node, JsonNode value) {
    ObjectNode fields = NODES.objectNode();
    fields.set("scope", dumpAll(node.scope()));
    return wrap(node.type(), fields);
  }

  @Override
  public JsonNode visit(AST.Function node, JsonNode value) {
    ObjectNode fields = NODES.objectNode();
    fields.put("name", node.name());
    fields.put("type", node.resultType());
    ArrayNode parameters = fields.putArray("parameters");
    for (AST.Function.Parameter parameter : node.parameters()) {
      parameters.addObject().put("name", parameter.name()).put("type", parameter.type());
    }
    fields.set("scope", dumpAll(node.scope()));
    return wrap(node.type(), fields);
  }

  @Override
  public JsonNode visit(AST.Call node, JsonNode value) {
    ObjectNode fields = NODES.objectNode();
    fields.put("who", node.who());
    fields.set("arguments", dumpAll(node.arguments()));
    return wrap(node.type(), fields);
  }

  @Override
  public JsonNode visit(AST.Arg node, JsonNode value) {
    ObjectNode fields = NODES.objectNode();
    fields.set("value", node.value().accept(this, null));
    return wrap(node.type(), fields);
  }

  @Override
  public JsonNode visit(AST.Return node, JsonNode value) {
    ObjectNode fields = NODES.objectNode();
    fields.put("type", node.valueType());
    if (node.value().isPresent()) {
      fields.set("value", node.value().get().accept(this, null));
    } else {
      fields.put("value", AST.NONE);
    }
    return wrap(node.type(), fields);
  }

  @Override
  public JsonNode visit(AST.Let node, JsonNode value) {
    ObjectNode fields = NODES.objectNode();
    fields.put("name", node.name());
    fields.put("type", node.valueType());
    fields.set("value", node.value().accept(this, null));
    return wrap(node.type(), fields);
  }

  @Override
  public JsonNode visit(AST.If node, JsonNode value) {
    ObjectNode fields = NODES.objectNode();
    fields.set("condition", node.condition().accept(this, null));
    fields.set("trueBranch", dumpAll(node.trueBranch()));
    fields.set("falseBranch", dumpAll(node.falseBranch()));
    return wrap(node.type(), fields);
  }

  @Override
  public JsonNode visit(AST.Literal node, JsonNode value) {
    return dumpExpression(node);
  }

  @Override
  public JsonNode visit(AST.Logical node, JsonNode value) {
    return dumpExpression(node);
  }

  @Override
  public JsonNode visit(AST.Arithmetic node, JsonNode value) {
    return dumpExpression(node);
  }

  private static JsonNode dumpExpression(AST.Expression node) {
    ObjectNode fields = NODES.objectNode();
    fields.put("value", node.value());
    return wrap(node.type(), fields);
  }
}

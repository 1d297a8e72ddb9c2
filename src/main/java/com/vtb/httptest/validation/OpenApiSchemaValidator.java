package com.vtb.httptest.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaException;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import com.vtb.httptest.exceptions.SchemaValidationException;
import com.vtb.httptest.models.HttpResponse;
import com.vtb.httptest.models.OperationDescriptor;
import com.vtb.httptest.models.SchemaValidationResult;
import com.vtb.httptest.models.ValidationError;
import com.vtb.httptest.models.ValidationOptions;
import io.swagger.v3.core.util.Json;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.parser.OpenAPIV3Parser;
import io.swagger.v3.parser.core.models.ParseOptions;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Validates JSON response bodies against an OpenAPI 3 document.
 * <p>
 * Path templates, status codes (exact, {@code NXX}, {@code default}) and media types are looked up in the
 * swagger model. The body schema is translated to a draft 4 JSON Schema and checked by the networknt
 * validator; component schemas become {@code definitions} and {@code nullable} becomes a {@code null}
 * type. Non-JSON bodies are only checked against the documented content types.
 */
@Slf4j
public class OpenApiSchemaValidator implements SchemaValidator {

    private static final String COMPONENTS_REF = "#/components/schemas/";
    private static final String DEFINITIONS_REF = "#/definitions/";
    private static final List<String> OPENAPI_ONLY_KEYWORDS = List.of(
        "nullable", "discriminator", "readOnly", "writeOnly", "xml", "externalDocs", "example", "deprecated");
    private static final ObjectMapper SWAGGER_JSON = Json.mapper();
    private static final JsonSchemaFactory SCHEMA_FACTORY = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V4);

    private final OpenAPI openAPI;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ObjectNode componentSchemas;
    private final Map<SchemaKey, JsonSchema> compiled = new ConcurrentHashMap<>();

    public OpenApiSchemaValidator(OpenAPI openAPI) {
        if (openAPI == null) {
            throw new IllegalArgumentException("OpenAPI document is required");
        }
        this.openAPI = openAPI;
        this.componentSchemas = SWAGGER_JSON.createObjectNode();
        if (openAPI.getComponents() != null && openAPI.getComponents().getSchemas() != null) {
            openAPI.getComponents().getSchemas()
                .forEach((name, schema) -> componentSchemas.set(name, SWAGGER_JSON.valueToTree(schema)));
        }
    }

    public static OpenApiSchemaValidator fromLocation(String location) throws SchemaValidationException {
        SwaggerParseResult result = new OpenAPIV3Parser().readLocation(location, null, parseOptions());
        return fromResult(result, location);
    }

    public static OpenApiSchemaValidator fromContents(String contents) throws SchemaValidationException {
        SwaggerParseResult result = new OpenAPIV3Parser().readContents(contents, null, parseOptions());
        return fromResult(result, "inline document");
    }

    @Override
    public SchemaValidationResult validate(HttpResponse response, OperationDescriptor operation,
                                           ValidationOptions options) throws SchemaValidationException {
        ValidationOptions opts = options != null ? options : ValidationOptions.builder().build();
        String label = operation.method() + " " + operation.path();
        PathMatch match = findPath(operation.path());
        if (match == null) {
            throw new SchemaValidationException("No documented path matches " + operation.path());
        }
        Operation op = findOperation(match.item(), operation.method());
        if (op == null) {
            throw new SchemaValidationException("No " + operation.method() + " operation for " + match.template());
        }

        List<ValidationError> errors = new ArrayList<>();
        String responseKey = findResponseKey(op, response.getStatusCode());
        if (responseKey == null) {
            errors.add(new ValidationError("", "Status " + response.getStatusCode() + " is not documented"));
            return result(errors, label, null);
        }
        ApiResponse apiResponse = resolveResponse(op.getResponses().get(responseKey));
        String schemaPath = match.template() + " " + operation.method().toUpperCase(Locale.ROOT) + " " + responseKey;
        Content content = apiResponse != null ? apiResponse.getContent() : null;
        if (content == null || content.isEmpty()) {
            return result(errors, label, schemaPath);
        }

        String mediaType = response.mediaType();
        MediaType documented = content.get(mediaType);
        if (documented == null && isJson(mediaType)) {
            documented = content.entrySet().stream()
                .filter(e -> isJson(e.getKey()))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
        }
        if (documented == null) {
            documented = content.get("*/*");
        }
        if (documented == null) {
            errors.add(new ValidationError("", "Content type " + mediaType + " is not documented (expected "
                + content.keySet() + ")"));
            return result(errors, label, schemaPath);
        }
        if (documented.getSchema() == null || !isJson(mediaType)) {
            return result(errors, label, schemaPath);
        }

        JsonNode body;
        try {
            byte[] bytes = response.getBody();
            body = bytes == null || bytes.length == 0 ? mapper.nullNode() : mapper.readTree(bytes);
        } catch (IOException e) {
            errors.add(new ValidationError("", "Body is not valid JSON: " + e.getMessage()));
            return result(errors, label, schemaPath);
        }
        errors.addAll(validateBody(body, documented.getSchema(), schemaPath + " " + mediaType, opts));
        return result(errors, label, schemaPath);
    }

    // --- lookup ---

    private record PathMatch(String template, PathItem item) {
    }

    private PathMatch findPath(String path) {
        if (openAPI.getPaths() == null || path == null) {
            return null;
        }
        PathItem exact = openAPI.getPaths().get(path);
        if (exact != null) {
            return new PathMatch(path, exact);
        }
        List<String> candidates = new ArrayList<>();
        candidates.add(path);
        for (String basePath : serverBasePaths()) {
            if (path.startsWith(basePath) && path.length() > basePath.length()) {
                candidates.add(path.substring(basePath.length()));
            }
        }
        for (Map.Entry<String, PathItem> entry : openAPI.getPaths().entrySet()) {
            Pattern template = templatePattern(entry.getKey());
            for (String candidate : candidates) {
                if (entry.getKey().equals(candidate) || template.matcher(candidate).matches()) {
                    return new PathMatch(entry.getKey(), entry.getValue());
                }
            }
        }
        return null;
    }

    private List<String> serverBasePaths() {
        List<String> basePaths = new ArrayList<>();
        if (openAPI.getServers() == null) {
            return basePaths;
        }
        for (Server server : openAPI.getServers()) {
            if (server.getUrl() == null) {
                continue;
            }
            try {
                String p = URI.create(server.getUrl()).getPath();
                if (p != null && p.length() > 1) {
                    basePaths.add(p.endsWith("/") ? p.substring(0, p.length() - 1) : p);
                }
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring server URL {}: {}", server.getUrl(), e.getMessage());
            }
        }
        return basePaths;
    }

    static Pattern templatePattern(String template) {
        StringBuilder regex = new StringBuilder("^");
        int i = 0;
        while (i < template.length()) {
            int open = template.indexOf('{', i);
            if (open < 0) {
                regex.append(Pattern.quote(template.substring(i)));
                break;
            }
            int close = template.indexOf('}', open);
            if (close < 0) {
                regex.append(Pattern.quote(template.substring(i)));
                break;
            }
            if (open > i) {
                regex.append(Pattern.quote(template.substring(i, open)));
            }
            regex.append("[^/]+");
            i = close + 1;
        }
        return Pattern.compile(regex.append('$').toString());
    }

    private static Operation findOperation(PathItem item, String method) {
        if (method == null) {
            return null;
        }
        for (Map.Entry<PathItem.HttpMethod, Operation> entry : item.readOperationsMap().entrySet()) {
            if (entry.getKey().name().equalsIgnoreCase(method.trim())) {
                return entry.getValue();
            }
        }
        return null;
    }

    /**
     * Exact status, then the {@code NXX} range, then {@code default}.
     */
    private static String findResponseKey(Operation op, int status) {
        if (op.getResponses() == null || op.getResponses().isEmpty()) {
            return null;
        }
        String exact = String.valueOf(status);
        if (op.getResponses().containsKey(exact)) {
            return exact;
        }
        String range = (status / 100) + "XX";
        for (String key : op.getResponses().keySet()) {
            if (key.equalsIgnoreCase(range)) {
                return key;
            }
        }
        return op.getResponses().containsKey("default") ? "default" : null;
    }

    private ApiResponse resolveResponse(ApiResponse response) {
        if (response == null || response.get$ref() == null || openAPI.getComponents() == null
            || openAPI.getComponents().getResponses() == null) {
            return response;
        }
        String ref = response.get$ref();
        ApiResponse resolved = openAPI.getComponents().getResponses().get(ref.substring(ref.lastIndexOf('/') + 1));
        return resolved != null ? resolved : response;
    }

    // --- body schema ---

    private record SchemaKey(String location, ValidationOptions options) {
    }

    private List<ValidationError> validateBody(JsonNode body, Schema<?> schema, String location, ValidationOptions opts)
        throws SchemaValidationException {
        Set<ValidationMessage> messages;
        try {
            JsonSchema jsonSchema = compiled.computeIfAbsent(new SchemaKey(location, opts),
                key -> SCHEMA_FACTORY.getSchema(toJsonSchema(schema, opts)));
            messages = jsonSchema.validate(body);
        } catch (JsonSchemaException e) {
            throw new SchemaValidationException("Cannot apply response schema of " + location + ": " + e.getMessage(), e);
        }
        List<ValidationError> errors = new ArrayList<>();
        for (ValidationMessage message : messages) {
            errors.add(toError(message));
        }
        errors.sort(Comparator.comparing(ValidationError::getPath).thenComparing(e -> String.valueOf(e.getKeyword())));
        return errors;
    }

    /**
     * Draft 4 document for one response schema. Components go to {@code definitions}, {@code nullable} becomes
     * a {@code null} type, and the relaxations in the options are applied by rewriting keywords.
     */
    ObjectNode toJsonSchema(Schema<?> schema, ValidationOptions opts) {
        JsonNode adapted = adapt(SWAGGER_JSON.valueToTree(schema), opts);
        ObjectNode root = adapted instanceof ObjectNode node ? node : SWAGGER_JSON.createObjectNode();
        ObjectNode definitions = root.putObject("definitions");
        componentSchemas.fields().forEachRemaining(e -> definitions.set(e.getKey(), adapt(e.getValue().deepCopy(), opts)));
        return root;
    }

    private JsonNode adapt(JsonNode schema, ValidationOptions opts) {
        if (!(schema instanceof ObjectNode node)) {
            return schema;
        }
        JsonNode ref = node.get("$ref");
        if (ref != null && ref.isTextual()) {
            String target = ref.textValue();
            if (target.startsWith(COMPONENTS_REF)) {
                node.put("$ref", DEFINITIONS_REF + target.substring(COMPONENTS_REF.length()));
            }
            return opts.isIgnoreNullable() ? nullOr(node) : node;
        }

        boolean nullable = node.path("nullable").asBoolean(false) || opts.isIgnoreNullable();
        List<String> dropped = new ArrayList<>(OPENAPI_ONLY_KEYWORDS);
        node.fieldNames().forEachRemaining(name -> {
            if (name.startsWith("x-")) {
                dropped.add(name);
            }
        });
        node.remove(dropped);
        if (opts.isIgnoreFormats()) {
            node.remove("format");
        }
        if (opts.isIgnorePatterns()) {
            node.remove("pattern");
        }
        if (opts.isIgnoreAdditionalProperties() && node.path("additionalProperties").isBoolean()) {
            node.remove("additionalProperties");
        }

        adaptProperties(node, opts);
        JsonNode items = node.get("items");
        if (items != null) {
            node.set("items", adapt(items, opts));
        }
        JsonNode additional = node.get("additionalProperties");
        if (additional != null && additional.isObject()) {
            node.set("additionalProperties", adapt(additional, opts));
        }
        JsonNode not = node.get("not");
        if (not != null) {
            node.set("not", adapt(not, opts));
        }
        boolean composed = false;
        for (String keyword : List.of("allOf", "anyOf", "oneOf")) {
            JsonNode parts = node.get(keyword);
            if (parts instanceof ArrayNode array) {
                composed = true;
                for (int i = 0; i < array.size(); i++) {
                    array.set(i, adapt(array.get(i), opts));
                }
            }
        }

        if (!nullable) {
            return node;
        }
        if (composed) {
            return nullOr(node);
        }
        allowNull(node);
        return node;
    }

    private void adaptProperties(ObjectNode node, ValidationOptions opts) {
        Set<String> ignored = new HashSet<>(opts.getIgnoredProperties() != null ? opts.getIgnoredProperties() : List.of());
        Set<String> required = new LinkedHashSet<>();
        node.path("required").forEach(name -> required.add(name.asText()));

        JsonNode properties = node.get("properties");
        if (properties instanceof ObjectNode props) {
            List<String> names = new ArrayList<>();
            props.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                boolean skipped = ignored.contains(name) || (opts.isRequiredPropertiesOnly() && !required.contains(name));
                props.set(name, skipped ? SWAGGER_JSON.createObjectNode() : adapt(props.get(name), opts));
            }
        }
        if (!ignored.isEmpty() && (properties != null || node.has("additionalProperties"))) {
            ObjectNode props = properties instanceof ObjectNode existing ? existing : node.putObject("properties");
            ignored.forEach(name -> props.set(name, SWAGGER_JSON.createObjectNode()));
        }
        if (node.has("required")) {
            required.removeAll(ignored);
            if (required.isEmpty()) {
                node.remove("required");
            } else {
                ArrayNode kept = node.putArray("required");
                required.forEach(kept::add);
            }
        }
    }

    private static void allowNull(ObjectNode node) {
        JsonNode type = node.get("type");
        if (type != null && type.isTextual() && !"null".equals(type.textValue())) {
            node.putArray("type").add(type.textValue()).add("null");
        } else if (type instanceof ArrayNode types && !containsNull(types)) {
            types.add("null");
        }
        if (node.get("enum") instanceof ArrayNode values && !containsNull(values)) {
            values.addNull();
        }
    }

    private static ObjectNode nullOr(ObjectNode schema) {
        ObjectNode wrapper = SWAGGER_JSON.createObjectNode();
        ArrayNode anyOf = wrapper.putArray("anyOf");
        anyOf.addObject().put("type", "null");
        anyOf.add(schema);
        return wrapper;
    }

    private static boolean containsNull(ArrayNode values) {
        for (JsonNode value : values) {
            if (value.isNull() || "null".equals(value.asText(null))) {
                return true;
            }
        }
        return false;
    }

    private static ValidationError toError(ValidationMessage message) {
        String location = message.getInstanceLocation() != null ? message.getInstanceLocation().toString() : "$";
        String path = location.startsWith("$") ? location.substring(1) : location;
        if (path.startsWith(".")) {
            path = path.substring(1);
        }
        String keyword = message.getType();
        String property = message.getProperty();
        if (property != null && ("required".equals(keyword) || "additionalProperties".equals(keyword))
            && !path.equals(property) && !path.endsWith("." + property)) {
            path = child(path, property);
        }
        String text = message.getMessage();
        if (text != null && text.startsWith(location + ": ")) {
            text = text.substring(location.length() + 2);
        }
        return new ValidationError(path, text, keyword);
    }

    private static boolean isJson(String mediaType) {
        return mediaType != null && (mediaType.equals("application/json") || mediaType.endsWith("+json"));
    }

    private static String child(String path, String name) {
        return path.isEmpty() ? name : path + "." + name;
    }

    private static SchemaValidationResult result(List<ValidationError> errors, String operation, String schemaPath) {
        return SchemaValidationResult.builder()
            .valid(errors.isEmpty())
            .errors(errors)
            .operation(operation)
            .schemaPath(schemaPath)
            .build();
    }

    private static ParseOptions parseOptions() {
        ParseOptions options = new ParseOptions();
        options.setResolve(true);
        options.setResolveFully(false);
        return options;
    }

    private static OpenApiSchemaValidator fromResult(SwaggerParseResult result, String source)
        throws SchemaValidationException {
        if (result == null || result.getOpenAPI() == null) {
            String messages = result != null && result.getMessages() != null ? String.join("; ", result.getMessages()) : "";
            throw new SchemaValidationException("Cannot parse OpenAPI document " + source + ": " + messages);
        }
        if (result.getMessages() != null) {
            result.getMessages().forEach(m -> log.debug("OpenAPI parser: {}", m));
        }
        return new OpenApiSchemaValidator(result.getOpenAPI());
    }
}

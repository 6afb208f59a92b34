package tech.lapse.platform.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.lapse.platform.authorization.ScopeCatalog;
import tech.lapse.platform.authorization.ScopeDefinition;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Builds the OpenAPI 3.0 document of the REST gateway from the procedure
 * catalog. Each catalog entry becomes one operation under
 * {@code /rest/{router}/{procedure}}, tagged with its router and secured with
 * its declared scopes.
 */
@ApplicationScoped
public class RestOpenApiDocument {

    static final String REST_BASE_PATH = "/rest";
    static final String TOKEN_PATH = "/oauth/token";

    @Inject
    RestProcedureCatalog catalog;

    @Inject
    ScopeCatalog scopeCatalog;

    @Inject
    ObjectMapper objectMapper;

    public ObjectNode build() {
        ObjectNode document = objectMapper.createObjectNode();
        document.put("openapi", "3.0.3");

        ObjectNode info = document.putObject("info");
        info.put("title", "Lapse REST API");
        info.put("version", "1.0.0");
        info.put("description", "Lapse procedures callable by first-party sessions and delegated service clients.");

        Set<String> routers = new LinkedHashSet<>();
        for (RestProcedureDefinition definition : catalog.all()) {
            routers.add(definition.router());
        }
        ArrayNode tags = document.putArray("tags");
        for (String router : routers) {
            tags.addObject().put("name", router);
        }

        ObjectNode paths = document.putObject("paths");
        paths.putObject(TOKEN_PATH).set("post", tokenOperation());
        for (RestProcedureDefinition definition : catalog.all()) {
            String path = REST_BASE_PATH + "/" + definition.router() + "/" + definition.procedure();
            ObjectNode pathItem = paths.has(path) ? (ObjectNode) paths.get(path) : paths.putObject(path);
            pathItem.set(definition.method().name().toLowerCase(Locale.ROOT), procedureOperation(definition));
        }

        document.set("components", components());
        return document;
    }

    private ObjectNode procedureOperation(RestProcedureDefinition definition) {
        ObjectNode operation = objectMapper.createObjectNode();
        operation.put("operationId", DefaultRestProcedureCatalog.key(definition.router(), definition.procedure()));
        operation.put("summary", definition.summary());
        operation.putArray("tags").add(definition.router());

        if (definition.method() == RestMethod.GET) {
            ObjectNode input = operation.putArray("parameters").addObject();
            input.put("name", "input");
            input.put("in", "query");
            input.put("required", false);
            input.putObject("schema").put("type", "string");
            input.put("description", "JSON-encoded input object.");
        } else {
            ObjectNode body = operation.putObject("requestBody");
            body.put("required", true);
            body.putObject("content").putObject("application/json").putObject("schema").put("type", "object");
        }

        ObjectNode responses = operation.putObject("responses");
        ObjectNode ok = responses.putObject("200");
        ok.put("description", "Successful response");
        ok.putObject("content").putObject("application/json").putObject("schema").put("type", "object");
        responses.putObject("400").put("description", "Bad request");
        responses.putObject("401").put("description", "Unauthorized");
        responses.putObject("403").put("description", "Forbidden");
        responses.putObject("500").put("description", "Server error");

        if (definition.requiresAuth()) {
            ObjectNode requirement = operation.putArray("security").addObject();
            if (definition.requiredScopes().isEmpty()) {
                requirement.putArray("bearerAuth");
            } else {
                ArrayNode scopes = requirement.putArray("oauth2");
                definition.requiredScopes().forEach(scopes::add);
            }
        }
        return operation;
    }

    private ObjectNode tokenOperation() {
        ObjectNode operation = objectMapper.createObjectNode();
        operation.put("operationId", "oauth.token");
        operation.put("summary", "OAuth2 token exchange (RFC 8693)");
        operation.putArray("tags").add("oauth");

        ObjectNode body = operation.putObject("requestBody");
        body.put("required", true);
        body.putObject("content").putObject("application/x-www-form-urlencoded")
            .putObject("schema").put("type", "object");

        ObjectNode responses = operation.putObject("responses");
        ObjectNode ok = responses.putObject("200");
        ok.put("description", "Token exchange response");
        ok.putObject("content").putObject("application/json").putObject("schema").put("type", "object");
        responses.putObject("400").put("description", "Bad request");
        responses.putObject("401").put("description", "Unauthorized");
        responses.putObject("403").put("description", "Forbidden");
        return operation;
    }

    private ObjectNode components() {
        ObjectNode components = objectMapper.createObjectNode();
        ObjectNode schemes = components.putObject("securitySchemes");

        ObjectNode bearer = schemes.putObject("bearerAuth");
        bearer.put("type", "http");
        bearer.put("scheme", "bearer");
        bearer.put("bearerFormat", "JWT");

        ObjectNode oauth2 = schemes.putObject("oauth2");
        oauth2.put("type", "oauth2");
        ObjectNode flow = oauth2.putObject("flows").putObject("clientCredentials");
        flow.put("tokenUrl", TOKEN_PATH);
        ObjectNode scopes = flow.putObject("scopes");
        for (ScopeDefinition scope : scopeCatalog.definitions()) {
            scopes.put(scope.name(), scope.description());
        }
        return components;
    }
}

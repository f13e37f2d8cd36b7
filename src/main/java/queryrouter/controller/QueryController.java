package queryrouter.controller;

import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Consumes;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.Produces;
import io.micronaut.scheduling.annotation.ExecuteOn;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import queryrouter.model.QueryType;
import queryrouter.service.QueryService;
import queryrouter.service.RoutedQuery;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON endpoints over the query router.
 * Engine calls block, so handlers run on the query executor rather than the event loop.
 */
@Controller("/query")
@ExecuteOn("queryExecutor")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class QueryController {

    private static final Logger LOG = LoggerFactory.getLogger(QueryController.class);

    private final QueryService queryService;

    public QueryController(QueryService queryService) {
        this.queryService = queryService;
    }

    /**
     * Classifies, routes and executes a statement.
     */
    @Post
    public HttpResponse<Map<String, Object>> route(@Valid @Body QueryRequest request) {
        LOG.debug("Handling query request (explain={}, timeoutMs={})",
                request.explainRequested(), request.timeoutMs());

        RoutedQuery routed = queryService.execute(
                request.query(), request.args(), request.explainRequested(), request.timeoutMs());

        Map<String, Object> body = routed.result().toMap(routed.queryType());
        body.put("engine", routed.engineName());
        return HttpResponse.ok(body);
    }

    /**
     * Explains how a statement would be planned and routed without executing it.
     */
    @Post("/explain")
    public HttpResponse<Map<String, Object>> explain(@Valid @Body QueryRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("queryType", queryService.classify(request.query()).name());
        body.put("explanation", queryService.explain(request.query()));
        return HttpResponse.ok(body);
    }

    /**
     * Returns the classification alone.
     */
    @Post("/classify")
    public HttpResponse<Map<String, Object>> classify(@Valid @Body QueryRequest request) {
        QueryType queryType = queryService.classify(request.query());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("queryType", queryType.name());
        return HttpResponse.ok(body);
    }
}

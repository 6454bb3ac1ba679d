package com.calldash.calldash.query;

import com.calldash.calldash.auth.AuthModels;
import com.calldash.calldash.auth.AuthService;
import com.calldash.calldash.data.IngestionException;
import jakarta.servlet.http.HttpSession;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.function.Supplier;

@RestController
@RequestMapping("/api/query")
public class QueryController {

    private final QueryService queryService;
    private final AuthService authService;

    public QueryController(QueryService queryService, AuthService authService) {
        this.queryService = queryService;
        this.authService = authService;
    }

    @PostMapping
    public ResponseEntity<QueryModels.QueryResponse> ask(
            @RequestBody QueryModels.NaturalLanguageQueryRequest request,
            HttpSession session
    ) {
        AuthModels.AuthUserResponse user = authService.requireCurrentUser(session);
        return ResponseEntity.ok(handle(() -> queryService.ask(request.message(), user.userId())));
    }

    @PostMapping("/structured")
    public ResponseEntity<QueryModels.QueryResponse> structured(
            @RequestBody QueryModels.QuerySpecification spec,
            HttpSession session
    ) {
        AuthModels.AuthUserResponse user = authService.requireCurrentUser(session);
        return ResponseEntity.ok(handle(() -> queryService.execute(spec, user.userId())));
    }

    @PostMapping(value = "/export", produces = "text/csv")
    public ResponseEntity<String> export(@RequestBody QueryModels.QuerySpecification spec, HttpSession session) {
        AuthModels.AuthUserResponse user = authService.requireCurrentUser(session);
        String csv = handle(() -> queryService.exportCsv(spec, user.userId()));
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + QueryConstants.EXPORT_FILE_NAME + "\"")
                .contentType(MediaType.parseMediaType("text/csv"))
                .body(csv);
    }

    private <T> T handle(Supplier<T> action) {
        try {
            return action.get();
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        } catch (IngestionException ex) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to load data", ex);
        }
    }
}

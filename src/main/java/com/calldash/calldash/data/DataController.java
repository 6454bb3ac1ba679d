package com.calldash.calldash.data;

import com.calldash.calldash.auth.AuthModels;
import com.calldash.calldash.auth.AuthService;
import jakarta.servlet.http.HttpSession;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * Serves the dataset merged from the active files and the caller's working view.
 */
@RestController
@RequestMapping("/api/data")
public class DataController {

    private final IngestionService ingestionService;
    private final WorkingViewCache workingViewCache;
    private final AuthService authService;

    public DataController(IngestionService ingestionService, WorkingViewCache workingViewCache, AuthService authService) {
        this.ingestionService = ingestionService;
        this.workingViewCache = workingViewCache;
        this.authService = authService;
    }

    @GetMapping
    public ResponseEntity<DataModels.MergedDataResponse> getData(
            @RequestParam(defaultValue = "false") boolean refresh,
            HttpSession session
    ) {
        authService.requireCurrentUser(session);
        return ResponseEntity.ok(DataModels.MergedDataResponse.of(loadMerged(refresh)));
    }

    @GetMapping("/working-view")
    public ResponseEntity<DataModels.MergedDataResponse> getWorkingView(HttpSession session) {
        AuthModels.AuthUserResponse user = authService.requireCurrentUser(session);
        Dataset view = workingViewCache.get(user.userId()).orElseGet(() -> loadMerged(false));
        return ResponseEntity.ok(DataModels.MergedDataResponse.of(view));
    }

    @DeleteMapping("/working-view")
    public ResponseEntity<Void> discardWorkingView(HttpSession session) {
        AuthModels.AuthUserResponse user = authService.requireCurrentUser(session);
        workingViewCache.discard(user.userId());
        return ResponseEntity.noContent().build();
    }

    private Dataset loadMerged(boolean refresh) {
        try {
            return ingestionService.loadAll(refresh);
        } catch (IngestionException ex) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to load data", ex);
        }
    }
}

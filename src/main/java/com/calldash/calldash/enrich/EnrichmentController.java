package com.calldash.calldash.enrich;

import com.calldash.calldash.auth.AuthModels;
import com.calldash.calldash.auth.AuthService;
import com.calldash.calldash.data.IngestionException;
import com.calldash.calldash.enrich.boe.ExternalFetchException;
import jakarta.servlet.http.HttpSession;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/enrich")
public class EnrichmentController {

    private final EnrichmentService enrichmentService;
    private final AuthService authService;

    public EnrichmentController(EnrichmentService enrichmentService, AuthService authService) {
        this.enrichmentService = enrichmentService;
        this.authService = authService;
    }

    @GetMapping
    public ResponseEntity<List<String>> listTypes(HttpSession session) {
        authService.requireCurrentUser(session);
        return ResponseEntity.ok(enrichmentService.availableTypes());
    }

    @PostMapping("/{type}")
    public ResponseEntity<EnrichmentModels.EnrichmentResponse> enrich(
            @PathVariable String type,
            @RequestBody(required = false) EnrichmentModels.EnrichmentRequest request,
            HttpSession session
    ) {
        AuthModels.AuthUserResponse user = authService.requireCurrentUser(session);
        try {
            EnrichmentResult result = enrichmentService.enrich(type, request == null ? null : request.data(), user.userId());
            return ResponseEntity.ok(EnrichmentModels.EnrichmentResponse.of(result));
        } catch (ExternalFetchException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, ex.getMessage(), ex);
        } catch (IngestionException ex) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to load data", ex);
        }
    }
}

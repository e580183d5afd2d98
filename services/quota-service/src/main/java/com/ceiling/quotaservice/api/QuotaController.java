package com.ceiling.quotaservice.api;

import com.ceiling.quota.QuotaService;
import com.ceiling.quotaservice.infrastructure.web.CallerHeaders;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST surface of the quota engine.
 *
 * <p>WHY: Listing and overrides are administrator operations; the check endpoint lets services
 * that do not embed the engine ask whether their caller may create one more resource. Errors are
 * rendered by {@link com.ceiling.quotaservice.infrastructure.web.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/quotas")
public class QuotaController {

    private final QuotaService quotaService;

    public QuotaController(QuotaService quotaService) {
        this.quotaService = quotaService;
    }

    @GetMapping("/{scope}/{id}")
    public List<QuotaStatusResponse> listQuotas(@PathVariable String scope, @PathVariable long id) {
        return quotaService.listQuotas(scope, id).stream()
                .map(QuotaStatusResponse::from)
                .toList();
    }

    @PutMapping
    public ResponseEntity<Void> updateQuota(@Valid @RequestBody UpdateQuotaRequest request) {
        quotaService.updateQuota(request.toCommand());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/users/{userId}")
    public ResponseEntity<Void> deleteByUser(@PathVariable long userId) {
        quotaService.deleteByUser(userId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/check/{targetService}")
    public QuotaCheckResponse check(@PathVariable String targetService, HttpServletRequest request) {
        boolean reached = quotaService.checkQuotaReachedForRequest(CallerHeaders.resolve(request), targetService);
        return new QuotaCheckResponse(targetService, reached);
    }
}

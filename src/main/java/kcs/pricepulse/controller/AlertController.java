package kcs.pricepulse.controller;

import jakarta.validation.Valid;
import java.util.List;
import kcs.pricepulse.service.AlertService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Alert endpoints. The caller is identified by the {@code X-User-Id} header; authentication
 * happens in front of this service.
 */
@RestController
@RequiredArgsConstructor
public class AlertController {

    static final String USER_HEADER = "X-User-Id";

    private final AlertService alertService;

    @PostMapping("/alerts")
    public ResponseEntity<AlertResponse> createAlert(@RequestHeader(USER_HEADER) String userId,
                                                     @Valid @RequestBody CreateAlertRequest request) {
        var alert = alertService.createAlert(userId, request.email(), request.productId(), request.targetPrice());
        return ResponseEntity.status(HttpStatus.CREATED).body(AlertResponse.from(alert));
    }

    @GetMapping("/alerts")
    public List<AlertResponse> listAlerts(@RequestHeader(USER_HEADER) String userId,
                                          @RequestParam(required = false) Long productId) {
        return alertService.listAlerts(userId, productId).stream().map(AlertResponse::from).toList();
    }

    @GetMapping("/products/{productId}/alerts")
    public List<AlertResponse> listProductAlerts(@RequestHeader(USER_HEADER) String userId,
                                                 @PathVariable Long productId) {
        return alertService.listAlerts(userId, productId).stream().map(AlertResponse::from).toList();
    }

    @GetMapping("/alerts/{alertId}")
    public AlertResponse getAlert(@RequestHeader(USER_HEADER) String userId, @PathVariable Long alertId) {
        return AlertResponse.from(alertService.getAlert(alertId, userId));
    }

    @DeleteMapping("/alerts/{alertId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteAlert(@RequestHeader(USER_HEADER) String userId, @PathVariable Long alertId) {
        alertService.deleteAlert(alertId, userId);
    }
}

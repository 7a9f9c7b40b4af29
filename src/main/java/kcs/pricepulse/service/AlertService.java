package kcs.pricepulse.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import kcs.pricepulse.entity.PriceAlert;
import kcs.pricepulse.entity.TrackedProduct;
import kcs.pricepulse.exception.AlertNotFoundException;
import kcs.pricepulse.exception.DuplicateAlertException;
import kcs.pricepulse.exception.ProductNotFoundException;
import kcs.pricepulse.repository.PriceAlertRepository;
import kcs.pricepulse.repository.TrackedProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Alert CRUD. Every read and delete is scoped to the calling user; another user's alert
 * is reported as not found.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertService {

    private final TrackedProductRepository productRepository;
    private final PriceAlertRepository alertRepository;
    private final Clock clock;

    @Transactional
    public PriceAlert createAlert(String userId, String userEmail, Long productId, long targetPrice) {
        TrackedProduct product = productRepository.findById(productId)
                .orElseThrow(() -> ProductNotFoundException.of(productId));
        if (alertRepository.existsByUserIdAndProduct_IdAndTargetPrice(userId, productId, targetPrice)) {
            throw DuplicateAlertException.of(userId, productId, targetPrice);
        }
        PriceAlert alert;
        try {
            alert = alertRepository.saveAndFlush(
                    PriceAlert.create(userId, userEmail, product, targetPrice, LocalDateTime.now(clock)));
        } catch (DataIntegrityViolationException e) {
            throw DuplicateAlertException.of(userId, productId, targetPrice);
        }
        log.info("createAlert: alertId={}, userId={}, productId={}, target={}", alert.getId(), userId, productId, targetPrice);
        return alert;
    }

    @Transactional(readOnly = true)
    public PriceAlert getAlert(Long alertId, String userId) {
        return alertRepository.findByIdAndUserId(alertId, userId)
                .orElseThrow(() -> AlertNotFoundException.of(alertId));
    }

    /** All of the user's alerts, or only those on {@code productId} when it is given. */
    @Transactional(readOnly = true)
    public List<PriceAlert> listAlerts(String userId, Long productId) {
        if (productId == null) {
            return alertRepository.findByUserIdOrderByIdDesc(userId);
        }
        return alertRepository.findByProduct_IdAndUserIdOrderByIdDesc(productId, userId);
    }

    @Transactional
    public void deleteAlert(Long alertId, String userId) {
        PriceAlert alert = alertRepository.findByIdAndUserId(alertId, userId)
                .orElseThrow(() -> AlertNotFoundException.of(alertId));
        alertRepository.delete(alert);
        log.info("deleteAlert: alertId={}, userId={}", alertId, userId);
    }
}

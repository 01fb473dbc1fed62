package com.crisisalert.repository.memory;

import com.crisisalert.domain.model.Alert;
import com.crisisalert.repository.AlertRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

/** Process-local alert storage. Alerts are removed by the expiry sweep. */
@Repository
public class InMemoryAlertRepository implements AlertRepository {

    private final ConcurrentHashMap<String, Alert> alertsById = new ConcurrentHashMap<>();

    @Override
    public Optional<Alert> findById(String id) {
        return Optional.ofNullable(alertsById.get(id));
    }

    @Override
    public Alert save(Alert alert) {
        alertsById.put(alert.getId(), alert);
        return alert;
    }

    @Override
    public void deleteById(String id) {
        alertsById.remove(id);
    }

    @Override
    public List<Alert> findAll() {
        return new ArrayList<>(alertsById.values());
    }

    @Override
    public List<Alert> findByUserId(String userId) {
        return alertsById.values().stream()
                .filter(alert -> userId.equals(alert.getUserId()))
                .toList();
    }
}

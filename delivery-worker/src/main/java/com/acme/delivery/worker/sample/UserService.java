package com.acme.delivery.worker.sample;

import com.acme.delivery.core.PermanentException;
import com.acme.delivery.core.RetryException;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Domain service for User operations
 */
@Singleton
public class UserService {
    private static final Logger logger = LoggerFactory.getLogger(UserService.class);

    private final Map<String, UserCreated> users = new ConcurrentHashMap<>();
    private final List<WelcomeEmail> pendingWelcomes = new ArrayList<>();
    private final Clock clock;

    @Inject
    public UserService() {
        this(Clock.systemUTC());
    }

    UserService(Clock clock) {
        this.clock = clock;
    }

    public void register(UserCreated user) {
        logger.info("Registering user {} ({})", user.id(), user.username());

        // Test failure scenarios
        if (user.username() != null && user.username().contains("failPermanent")) {
            throw new PermanentException("Invariant broken");
        }
        if (user.username() != null && user.username().contains("failTransient")) {
            throw new RetryException("Downstream timeout");
        }

        if (users.putIfAbsent(user.id(), user) == null) {
            synchronized (pendingWelcomes) {
                pendingWelcomes.add(new WelcomeEmail(user.id(), user.email(), clock.instant()));
            }
        }
    }

    public void forget(String userId) {
        if (users.remove(userId) != null) {
            logger.info("User {} deleted", userId);
        }
    }

    public boolean isRegistered(String userId) {
        return users.containsKey(userId);
    }

    /** Put back welcome emails that could not be queued, ahead of newer ones. */
    public void restorePendingWelcomes(List<WelcomeEmail> welcomes) {
        synchronized (pendingWelcomes) {
            pendingWelcomes.addAll(0, welcomes);
        }
    }

    /** Welcome emails not handed to the queue yet; taking them clears the list. */
    public List<WelcomeEmail> takePendingWelcomes() {
        synchronized (pendingWelcomes) {
            List<WelcomeEmail> taken = new ArrayList<>(pendingWelcomes);
            pendingWelcomes.clear();
            return taken;
        }
    }
}

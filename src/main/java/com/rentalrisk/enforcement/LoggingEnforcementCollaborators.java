package com.rentalrisk.enforcement;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Log-only execution collaborators. A host application wires real ones by
 * declaring {@code @Primary} beans of the same interfaces.
 */
@Configuration
public class LoggingEnforcementCollaborators {

    private static final Logger log = LoggerFactory.getLogger(LoggingEnforcementCollaborators.class);

    @Bean
    public NotificationDispatcher notificationDispatcher() {
        return new NotificationDispatcher() {
            @Override
            public void notifyParties(String bookingId, String productId, String renterId, EnforcementAction action) {
                log.info("[notify] booking={} renter={} severity={}: {}",
                    bookingId, renterId, action.severity().getValue(), action.message());
            }

            @Override
            public void notifyAdministrators(String bookingId, EnforcementAction action) {
                log.info("[notify-admin] booking={}: {}", bookingId, action.message());
            }
        };
    }

    @Bean
    public BookingBlocker bookingBlocker() {
        return (bookingId, reason) -> log.info("[block] booking={}: {}", bookingId, reason);
    }

    @Bean
    public RequirementEnforcer requirementEnforcer() {
        return new RequirementEnforcer() {
            @Override
            public void requireInsurance(String bookingId, EnforcementAction action) {
                log.info("[require-insurance] booking={} deadline={}", bookingId, action.deadline());
            }

            @Override
            public void requireInspection(String bookingId, EnforcementAction action) {
                log.info("[require-inspection] booking={} deadline={}", bookingId, action.deadline());
            }
        };
    }
}

package com.karting.entries.mail;

import com.karting.entries.compliance.PayerDataMasker;
import com.karting.entries.domain.EntryItem;
import com.karting.entries.persistence.entity.DriverEntity;
import com.karting.entries.persistence.entity.EventEntity;
import com.karting.entries.persistence.entity.PoolEngineRentalEntity;
import com.karting.entries.persistence.entity.RaceEntryEntity;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds and enqueues every e-mail the service sends. Failures are logged and never reach the
 * caller: a lost e-mail must not undo an entry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntryNotifications {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneId.of("Africa/Johannesburg"));

    private final TemplateRenderer renderer;
    private final MailQueue mailQueue;

    @Value("${karting.mail.admin-email:win@rokthenats.co.za}")
    private String adminEmail;

    @Value("${karting.barcode.max-chars:12}")
    private int barcodeMaxChars;

    @Value("${karting.barcode.module-width:2}")
    private int barcodeModuleWidth;

    @Value("${karting.barcode.height:60}")
    private int barcodeHeight;

    @PostConstruct
    void registerBatchHandler() {
        mailQueue.setBatchHandler(this::sendActivitySummary);
    }

    public void raceEntryConfirmation(DriverEntity driver, EventEntity event, RaceEntryEntity entry) {
        guard("race-entry-confirmation", entry.getPaymentReference(), () -> {
            Map<String, Object> model = new LinkedHashMap<>();
            model.put("driverName", driver.getFullName());
            model.put("eventName", event.getName());
            model.put("eventDate", event.getEventDate());
            model.put("venue", event.getVenue());
            model.put("raceClass", entry.getRaceClass());
            model.put("amount", formatRand(entry.getAmountPaid()));
            model.put("paymentReference", entry.getPaymentReference());
            model.put("paymentStatus", entry.getPaymentStatus());
            model.put("teamCode", entry.getTeamCode());

            EmailMessage.EmailMessageBuilder message = EmailMessage.builder();
            for (EntryItem item : EntryItem.values()) {
                String ref = entry.getTicketRef(item);
                if (ref == null) {
                    continue;
                }
                model.put(item.getTag(), Boolean.TRUE);
                model.put(item.getTag() + "Ref", ref);
                model.put(item.getTag() + "Label", item.getLabel());
                message.image(barcode(item.getTag() + "-barcode", ref));
            }
            enqueue(message, MailTemplate.RACE_ENTRY_CONFIRMATION, driver, model);
        });
    }

    public void poolRentalConfirmation(DriverEntity driver, PoolEngineRentalEntity rental) {
        guard("pool-rental-confirmation", rental.getPaymentReference(), () -> {
            Map<String, Object> model = new LinkedHashMap<>();
            model.put("driverName", driver.getFullName());
            model.put("championshipClass", rental.getChampionshipClass());
            model.put("rentalType", rental.getRentalType());
            model.put("seasonYear", rental.getSeasonYear());
            model.put("amount", formatRand(rental.getAmountPaid()));
            model.put("paymentReference", rental.getPaymentReference());
            enqueue(EmailMessage.builder(), MailTemplate.POOL_RENTAL_CONFIRMATION, driver, model);
        });
    }

    public void registrationConfirmation(DriverEntity driver) {
        guard("registration-confirmation", driver.getDriverId(), () -> {
            Map<String, Object> model = new LinkedHashMap<>();
            model.put("driverName", driver.getFullName());
            model.put("championshipClass", driver.getChampionshipClass());
            model.put("raceNumber", driver.getRaceNumber());
            model.put("email", driver.getEmail());
            enqueue(EmailMessage.builder(), MailTemplate.REGISTRATION_CONFIRMATION, driver, model);
        });
    }

    public void passwordReset(DriverEntity driver, String resetLink, int validMinutes) {
        guard("password-reset", driver.getDriverId(), () -> {
            Map<String, Object> model = new LinkedHashMap<>();
            model.put("driverName", driver.getFullName());
            model.put("resetLink", resetLink);
            model.put("validMinutes", validMinutes);
            enqueue(EmailMessage.builder(), MailTemplate.PASSWORD_RESET, driver, model);
        });
    }

    /** High-frequency admin notice; folded into the next activity summary. */
    public void adminActivity(String action, String subjectId, String detail) {
        mailQueue.addToBatch(new AdminActivity(action, subjectId, detail, Instant.now()));
    }

    void sendActivitySummary(List<AdminActivity> activities) {
        Map<String, Integer> counts = new TreeMap<>();
        StringBuilder lines = new StringBuilder();
        for (AdminActivity activity : activities) {
            counts.merge(activity.getAction(), 1, Integer::sum);
            lines.append(TIME.format(activity.getOccurredAt()))
                    .append(" - ").append(activity.getAction())
                    .append(" - ").append(activity.getSubjectId())
                    .append(activity.getDetail() == null ? "" : " - " + activity.getDetail())
                    .append('\n');
        }
        StringBuilder summary = new StringBuilder();
        counts.forEach((action, count) -> summary.append(action).append(": ").append(count).append('\n'));

        Map<String, Object> model = new LinkedHashMap<>();
        model.put("totalActions", activities.size());
        model.put("timeRange", TIME.format(activities.get(0).getOccurredAt())
                + " - " + TIME.format(activities.get(activities.size() - 1).getOccurredAt()));
        model.put("summary", summary.toString().trim());
        model.put("actions", lines.toString().trim());

        EmailMessage message = EmailMessage.builder()
                .toEmail(adminEmail)
                .toName("Registry admin")
                .subject(renderer.renderSubject(MailTemplate.ADMIN_ACTIVITY_SUMMARY, model))
                .html(renderer.render(MailTemplate.ADMIN_ACTIVITY_SUMMARY, model))
                .templateName(MailTemplate.ADMIN_ACTIVITY_SUMMARY.getTemplateName())
                .build();
        mailQueue.enqueue(message);
        log.info("Admin activity summary queued: actions={}", activities.size());
    }

    private void enqueue(EmailMessage.EmailMessageBuilder message, MailTemplate template,
                         DriverEntity driver, Map<String, Object> model) {
        mailQueue.enqueue(message
                .toEmail(driver.getEmail())
                .toName(driver.getFullName())
                .subject(renderer.renderSubject(template, model))
                .html(renderer.render(template, model))
                .templateName(template.getTemplateName())
                .build());
        log.info("Mail queued: template={}, to={}", template.getTemplateName(), PayerDataMasker.maskEmail(driver.getEmail()));
    }

    private InlineImage barcode(String contentId, String ticketRef) {
        String payload = Code39Barcode.payload(ticketRef, barcodeMaxChars);
        return new InlineImage(contentId, "image/png",
                Code39Barcode.renderPng(payload, barcodeModuleWidth, barcodeHeight));
    }

    private static String formatRand(BigDecimal amount) {
        if (amount == null) {
            return "R0.00";
        }
        return "R" + String.format(Locale.ROOT, "%,.2f", amount.setScale(2, RoundingMode.HALF_UP));
    }

    private static void guard(String template, String subject, Runnable work) {
        try {
            work.run();
        } catch (RuntimeException e) {
            log.error("Mail preparation failed: template={}, subject={}", template, subject, e);
        }
    }
}

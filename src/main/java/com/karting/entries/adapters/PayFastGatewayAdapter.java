package com.karting.entries.adapters;

import com.karting.entries.api.GatewayConstructionException;
import com.karting.entries.api.SignatureInvalidException;
import com.karting.entries.core.GatewayAdapter;
import com.karting.entries.domain.GatewayCheckout;
import com.karting.entries.domain.GatewayForm;
import com.karting.entries.domain.GatewayPaymentStatus;
import com.karting.entries.domain.WebhookNotification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * PayFast hosted checkout. Outbound forms and inbound ITN notifications are both signed with an
 * MD5 digest over the URL-encoded fields in PayFast's documented order, followed by the passphrase.
 */
@Slf4j
@Component
public class PayFastGatewayAdapter implements GatewayAdapter {

    static final String SIGNATURE_FIELD = "signature";

    private static final List<String> NOTIFICATION_FIELDS = List.of(
            "m_payment_id", "pf_payment_id", "payment_status", "item_name", "item_description",
            "amount_gross", "amount_fee", "amount_net", "custom_int1", "custom_int2", "custom_int3",
            "custom_int4", "custom_int5", "custom_str1", "custom_str2", "custom_str3", "custom_str4",
            "custom_str5", "name_first", "name_last", "email_address", "cell_number", "merchant_id");

    private static final int MAX_ITEM_NAME = 100;
    private static final int MAX_ITEM_DESCRIPTION = 255;

    @Value("${karting.payfast.merchant-id:10000100}")
    private String merchantId;

    @Value("${karting.payfast.merchant-key:46f0cd694581a}")
    private String merchantKey;

    @Value("${karting.payfast.passphrase:}")
    private String passphrase;

    @Value("${karting.payfast.process-url:https://sandbox.payfast.co.za/eng/process}")
    private String processUrl;

    @Override
    public String getGatewayName() {
        return "PayFast";
    }

    @Override
    public GatewayForm buildCheckoutForm(GatewayCheckout checkout) {
        if (checkout.getPaymentReference() == null || checkout.getPaymentReference().isBlank()) {
            throw new GatewayConstructionException("Payment reference is required");
        }
        if (checkout.getAmount() == null || checkout.getAmount().signum() <= 0) {
            throw new GatewayConstructionException("Gateway amount must be positive, got " + checkout.getAmount());
        }
        if (merchantId == null || merchantId.isBlank() || merchantKey == null || merchantKey.isBlank()) {
            throw new GatewayConstructionException("Gateway merchant credentials are not configured");
        }

        // Documented field order; the signature depends on it.
        Map<String, String> fields = new LinkedHashMap<>();
        putIfPresent(fields, "merchant_id", merchantId);
        putIfPresent(fields, "merchant_key", merchantKey);
        putIfPresent(fields, "return_url", checkout.getReturnUrl());
        putIfPresent(fields, "cancel_url", checkout.getCancelUrl());
        putIfPresent(fields, "notify_url", checkout.getNotifyUrl());
        putIfPresent(fields, "name_first", checkout.getPayerFirstName());
        putIfPresent(fields, "name_last", checkout.getPayerLastName());
        putIfPresent(fields, "email_address", checkout.getPayerEmail());
        putIfPresent(fields, "m_payment_id", checkout.getPaymentReference());
        putIfPresent(fields, "amount", formatAmount(checkout.getAmount()));
        putIfPresent(fields, "item_name", truncate(checkout.getItemName(), MAX_ITEM_NAME));
        putIfPresent(fields, "item_description", truncate(checkout.getItemDescription(), MAX_ITEM_DESCRIPTION));

        String signature;
        try {
            signature = sign(fields);
        } catch (RuntimeException e) {
            throw new GatewayConstructionException("Could not sign gateway form", e);
        }
        fields.put(SIGNATURE_FIELD, signature);
        log.debug("Built PayFast form: paymentReference={}, amount={}", checkout.getPaymentReference(), fields.get("amount"));
        return new GatewayForm(processUrl, fields, checkout.getPaymentReference());
    }

    @Override
    public WebhookNotification verifyNotification(Map<String, String> payload, Map<String, String> headers) {
        String received = payload.get(SIGNATURE_FIELD);
        if (received == null || received.isBlank()) {
            throw new SignatureInvalidException("Notification carries no signature");
        }
        Map<String, String> signed = new LinkedHashMap<>();
        for (String field : NOTIFICATION_FIELDS) {
            putIfPresent(signed, field, payload.get(field));
        }
        String expected = sign(signed);
        if (!MessageDigest.isEqual(expected.getBytes(StandardCharsets.US_ASCII),
                received.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII))) {
            log.warn("PayFast signature mismatch: m_payment_id={}", payload.get("m_payment_id"));
            throw new SignatureInvalidException("Notification signature does not verify");
        }

        String rawStatus = payload.get("payment_status");
        return WebhookNotification.builder()
                .paymentReference(classify(payload.get("m_payment_id")))
                .pfPaymentId(trimToNull(payload.get("pf_payment_id")))
                .amountGross(parseAmount(payload.get("amount_gross")))
                .paymentStatus(GatewayPaymentStatus.fromWire(rawStatus))
                .rawPaymentStatus(rawStatus)
                .payerEmail(trimToNull(payload.get("email_address")))
                .payerFirstName(trimToNull(payload.get("name_first")))
                .payerLastName(trimToNull(payload.get("name_last")))
                .itemName(trimToNull(payload.get("item_name")))
                .rawFields(Map.copyOf(payload))
                .build();
    }

    /**
     * MD5 over {@code key=urlencode(value)&...&passphrase=...}, lower-case hex. Blank values are
     * skipped; the passphrase is appended only when configured.
     */
    String sign(Map<String, String> orderedFields) {
        StringBuilder paramString = new StringBuilder();
        for (Map.Entry<String, String> field : orderedFields.entrySet()) {
            if (SIGNATURE_FIELD.equals(field.getKey()) || field.getValue() == null || field.getValue().isBlank()) {
                continue;
            }
            if (paramString.length() > 0) {
                paramString.append('&');
            }
            paramString.append(field.getKey()).append('=').append(encode(field.getValue().trim()));
        }
        if (passphrase != null && !passphrase.isBlank()) {
            paramString.append("&passphrase=").append(encode(passphrase.trim()));
        }
        return DigestUtils.md5DigestAsHex(paramString.toString().getBytes(StandardCharsets.UTF_8));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static void putIfPresent(Map<String, String> fields, String key, String value) {
        if (value != null && !value.isBlank()) {
            fields.put(key, value.trim());
        }
    }

    private static String formatAmount(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static BigDecimal parseAmount(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(value.trim().replace(",", ""));
        } catch (NumberFormatException e) {
            log.warn("Unparseable amount_gross={} on notification", value);
            return null;
        }
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}

package com.karting.entries.mail;

/**
 * Templates the mailer knows, by name. The HTML lives under {@code email-templates/} on the classpath.
 */
public enum MailTemplate {
    REGISTRATION_CONFIRMATION("registration-confirmation", "Welcome to the championship driver registry"),
    PASSWORD_RESET("password-reset", "Reset your driver registry password"),
    RACE_ENTRY_CONFIRMATION("race-entry-confirmation", "Race entry confirmation - {{eventName}}"),
    POOL_RENTAL_CONFIRMATION("pool-rental-confirmation", "Season engine rental confirmation - {{championshipClass}}"),
    ADMIN_ACTIVITY_SUMMARY("admin-activity-summary", "[BATCH] {{totalActions}} driver actions");

    private final String templateName;
    private final String subjectPattern;

    MailTemplate(String templateName, String subjectPattern) {
        this.templateName = templateName;
        this.subjectPattern = subjectPattern;
    }

    public String getTemplateName() {
        return templateName;
    }

    public String getSubjectPattern() {
        return subjectPattern;
    }

    public String getResourcePath() {
        return "email-templates/" + templateName + ".html";
    }
}

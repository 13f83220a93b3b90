package com.karting.entries.mail;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class EmailMessage {

    String toEmail;
    String toName;
    String subject;
    String html;
    String text;
    /** Template the message was rendered from, for logging. */
    String templateName;
    @Singular
    List<InlineImage> images;
}

package com.karting.entries.mail;

import lombok.Value;

/**
 * Image embedded in the message and referenced from the HTML as {@code cid:<contentId>}.
 */
@Value
public class InlineImage {

    String contentId;
    String mimeType;
    byte[] content;
}

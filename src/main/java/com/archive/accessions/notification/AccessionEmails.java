package com.archive.accessions.notification;

import com.archive.accessions.model.ArchivedRecord;
import org.springframework.web.util.HtmlUtils;

public final class AccessionEmails {

    private AccessionEmails() {
    }

    public static String subject(ArchivedRecord record) {
        return "Your URL has been archived: " + record.title();
    }

    public static String body(ArchivedRecord record, Long recordId) {
        return """
            <p>Your request to archive <a href="%1$s">%1$s</a> is complete.</p>
            <p>Title: %2$s<br/>Accession ID: %3$d</p>
            """.formatted(
            HtmlUtils.htmlEscape(record.seedUrl()),
            HtmlUtils.htmlEscape(record.title()),
            recordId
        );
    }
}

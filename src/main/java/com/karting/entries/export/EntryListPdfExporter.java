package com.karting.entries.export;

import com.karting.entries.api.NotFoundException;
import com.karting.entries.domain.EntryItem;
import com.karting.entries.domain.EntryStatus;
import com.karting.entries.mail.Code39Barcode;
import com.karting.entries.persistence.entity.DriverEntity;
import com.karting.entries.persistence.entity.EventEntity;
import com.karting.entries.persistence.entity.RaceEntryEntity;
import com.karting.entries.persistence.repository.DriverRepository;
import com.karting.entries.persistence.repository.EventRepository;
import com.karting.entries.persistence.repository.RaceEntryRepository;
import com.lowagie.text.Document;
import com.lowagie.text.Element;
import com.lowagie.text.Font;
import com.lowagie.text.FontFactory;
import com.lowagie.text.Image;
import com.lowagie.text.PageSize;
import com.lowagie.text.Paragraph;
import com.lowagie.text.Phrase;
import com.lowagie.text.pdf.PdfPCell;
import com.lowagie.text.pdf.PdfPTable;
import com.lowagie.text.pdf.PdfWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.awt.Color;
import java.io.ByteArrayOutputStream;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Landscape A4 entry list for race day: one row per live entry with a Code 39 barcode for every
 * ticket the entry holds. Cancelled entries are left out.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EntryListPdfExporter {

    private static final Color HEADER_COLOUR = new Color(5, 150, 105);
    private static final Color STRIPE_COLOUR = new Color(248, 249, 250);
    private static final DateTimeFormatter ISSUED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final EventRepository eventRepository;
    private final RaceEntryRepository entryRepository;
    private final DriverRepository driverRepository;

    @Value("${karting.barcode.max-chars:12}")
    private int barcodeMaxChars;

    @Value("${karting.export.zone:Africa/Johannesburg}")
    private String zone;

    public byte[] export(String eventId) {
        EventEntity event = eventRepository.findById(eventId)
                .orElseThrow(() -> new NotFoundException("Event " + eventId + " not found"));
        List<RaceEntryEntity> entries = entryRepository.findByEventIdOrderByCreatedAtAsc(eventId).stream()
                .filter(e -> e.getEntryStatus() != EntryStatus.CANCELLED)
                .collect(Collectors.toList());
        Map<String, DriverEntity> drivers = driverRepository.findAllById(
                        entries.stream().map(RaceEntryEntity::getDriverId).distinct().collect(Collectors.toList()))
                .stream()
                .collect(Collectors.toMap(DriverEntity::getDriverId, Function.identity()));
        byte[] pdf = render(event, entries, drivers);
        log.info("Entry list exported: eventId={}, entries={}, bytes={}", eventId, entries.size(), pdf.length);
        return pdf;
    }

    byte[] render(EventEntity event, List<RaceEntryEntity> entries, Map<String, DriverEntity> drivers) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Document document = new Document(PageSize.A4.rotate(), 20, 20, 20, 20);
        try {
            PdfWriter.getInstance(document, out);
            document.open();

            Font title = FontFactory.getFont(FontFactory.HELVETICA_BOLD, 16, HEADER_COLOUR);
            Font small = FontFactory.getFont(FontFactory.HELVETICA, 8, Color.DARK_GRAY);
            document.add(new Paragraph("RACE ENTRIES WITH BARCODES", title));
            document.add(new Paragraph(event.getName() + (event.getEventDate() == null ? "" : " - " + event.getEventDate()), small));
            document.add(new Paragraph("Issued: " + ZonedDateTime.now(ZoneId.of(zone)).format(ISSUED)
                    + "    Total entries: " + entries.size(), small));
            document.add(new Paragraph(" ", small));

            PdfPTable table = new PdfPTable(new float[] {18, 10, 16, 14, 14, 14, 14});
            table.setWidthPercentage(100);
            table.setHeaderRows(1);
            addHeader(table, "Driver Name");
            addHeader(table, "Class");
            addHeader(table, "Email");
            for (EntryItem item : EntryItem.values()) {
                addHeader(table, item.getLabel() + " Ticket");
            }

            Font cellFont = FontFactory.getFont(FontFactory.HELVETICA, 8);
            int row = 0;
            for (RaceEntryEntity entry : entries) {
                Color background = row++ % 2 == 0 ? Color.WHITE : STRIPE_COLOUR;
                DriverEntity driver = drivers.get(entry.getDriverId());
                table.addCell(textCell(driver == null ? entry.getDriverId() : driver.getFullName(), cellFont, background));
                table.addCell(textCell(entry.getRaceClass() == null ? "-" : entry.getRaceClass(), cellFont, background));
                table.addCell(textCell(driver == null ? "-" : driver.getEmail(), cellFont, background));
                for (EntryItem item : EntryItem.values()) {
                    table.addCell(ticketCell(entry.getTicketRef(item), cellFont, background));
                }
            }
            document.add(table);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Could not render entry list for event " + event.getEventId(), e);
        } finally {
            if (document.isOpen()) {
                document.close();
            }
        }
        return out.toByteArray();
    }

    private PdfPCell ticketCell(String ticketRef, Font font, Color background) throws Exception {
        if (ticketRef == null) {
            PdfPCell empty = textCell("-", font, background);
            empty.setHorizontalAlignment(Element.ALIGN_CENTER);
            return empty;
        }
        String payload = Code39Barcode.payload(ticketRef, barcodeMaxChars);
        PdfPCell cell = new PdfPCell();
        cell.setBackgroundColor(background);
        cell.setPadding(3);
        Image barcode = Image.getInstance(Code39Barcode.renderPng(payload, 2, 40));
        barcode.scaleToFit(110, 28);
        barcode.setAlignment(Element.ALIGN_CENTER);
        cell.addElement(barcode);
        Paragraph caption = new Paragraph(payload, FontFactory.getFont(FontFactory.COURIER_BOLD, 7));
        caption.setAlignment(Element.ALIGN_CENTER);
        cell.addElement(caption);
        return cell;
    }

    private static void addHeader(PdfPTable table, String text) {
        PdfPCell cell = new PdfPCell(new Phrase(text.toUpperCase(Locale.ROOT), FontFactory.getFont(FontFactory.HELVETICA_BOLD, 8, Color.WHITE)));
        cell.setBackgroundColor(HEADER_COLOUR);
        cell.setPadding(5);
        table.addCell(cell);
    }

    private static PdfPCell textCell(String text, Font font, Color background) {
        PdfPCell cell = new PdfPCell(new Phrase(text, font));
        cell.setBackgroundColor(background);
        cell.setPadding(5);
        return cell;
    }
}

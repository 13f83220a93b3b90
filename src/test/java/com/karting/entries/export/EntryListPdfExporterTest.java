package com.karting.entries.export;

import com.karting.entries.api.NotFoundException;
import com.karting.entries.domain.EntryItem;
import com.karting.entries.domain.EntryStatus;
import com.karting.entries.domain.PaymentStatus;
import com.karting.entries.persistence.entity.DriverEntity;
import com.karting.entries.persistence.entity.EventEntity;
import com.karting.entries.persistence.entity.RaceEntryEntity;
import com.karting.entries.persistence.repository.DriverRepository;
import com.karting.entries.persistence.repository.EventRepository;
import com.karting.entries.persistence.repository.RaceEntryRepository;
import com.lowagie.text.pdf.PdfReader;
import com.lowagie.text.pdf.parser.PdfTextExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EntryListPdfExporterTest {

    @Mock
    private EventRepository eventRepository;
    @Mock
    private RaceEntryRepository entryRepository;
    @Mock
    private DriverRepository driverRepository;

    private EntryListPdfExporter exporter;

    @BeforeEach
    void setUp() {
        exporter = new EntryListPdfExporter(eventRepository, entryRepository, driverRepository);
        ReflectionTestUtils.setField(exporter, "barcodeMaxChars", 12);
        ReflectionTestUtils.setField(exporter, "zone", "Africa/Johannesburg");
    }

    @Test
    void exportListsLiveEntriesWithTheirDrivers() throws IOException {
        when(eventRepository.findById("E-RED")).thenReturn(Optional.of(EventEntity.builder()
                .eventId("E-RED").name("Red Star Nationals").eventDate(LocalDate.of(2026, 3, 14)).build()));
        RaceEntryEntity live = entry("entry-1", "D-001", EntryStatus.CONFIRMED);
        live.setTicketEngineRef("ENG-D001-ERED-1700000000000-ABC123");
        RaceEntryEntity cancelled = entry("entry-2", "D-002", EntryStatus.CANCELLED);
        when(entryRepository.findByEventIdOrderByCreatedAtAsc("E-RED")).thenReturn(List.of(live, cancelled));
        when(driverRepository.findAllById(anyList())).thenReturn(List.of(DriverEntity.builder()
                .driverId("D-001").firstName("Dee").lastName("River").email("dee@example.test").build()));

        byte[] pdf = exporter.export("E-RED");

        assertThat(new String(pdf, 0, 5, StandardCharsets.US_ASCII)).isEqualTo("%PDF-");
        PdfReader reader = new PdfReader(pdf);
        try {
            String text = new PdfTextExtractor(reader).getTextFromPage(1);
            assertThat(text).contains("Red Star Nationals", "Dee River", "Total entries: 1", "000-ABC123")
                    .doesNotContain("D-002");
        } finally {
            reader.close();
        }
    }

    @Test
    void unknownEventIsNotFound() {
        when(eventRepository.findById("E-NONE")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> exporter.export("E-NONE")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void entryWithoutDriverRecordFallsBackToDriverId() {
        EventEntity event = EventEntity.builder().eventId("E-RED").name("Red Star Nationals").build();

        byte[] pdf = exporter.render(event, List.of(entry("entry-9", "D-404", EntryStatus.CONFIRMED)), Map.of());

        assertThat(pdf.length).isGreaterThan(500);
    }

    private static RaceEntryEntity entry(String entryId, String driverId, EntryStatus status) {
        return RaceEntryEntity.builder()
                .entryId(entryId)
                .driverId(driverId)
                .eventId("E-RED")
                .raceClass("Senior Rotax")
                .entryItems(List.of(EntryItem.ENGINE))
                .paymentStatus(status == EntryStatus.CANCELLED ? PaymentStatus.FAILED : PaymentStatus.COMPLETED)
                .entryStatus(status)
                .build();
    }
}

package sp.sistemaspalacios.api_marcacion.service.attendance;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionSystemException;
import sp.sistemaspalacios.api_marcacion.config.MarkingProperties;
import sp.sistemaspalacios.api_marcacion.dto.attendance.CallerIdentity;
import sp.sistemaspalacios.api_marcacion.dto.attendance.MarkingNotification;
import sp.sistemaspalacios.api_marcacion.dto.attendance.MarkingRequest;
import sp.sistemaspalacios.api_marcacion.dto.attendance.MarkingResult;
import sp.sistemaspalacios.api_marcacion.dto.attendance.TodayAttendanceDTO;
import sp.sistemaspalacios.api_marcacion.dto.location.Coordinate;
import sp.sistemaspalacios.api_marcacion.dto.location.QrFormat;
import sp.sistemaspalacios.api_marcacion.dto.location.QrPayload;
import sp.sistemaspalacios.api_marcacion.dto.location.ValidationReport;
import sp.sistemaspalacios.api_marcacion.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.api_marcacion.entity.attendance.MarcationType;
import sp.sistemaspalacios.api_marcacion.exception.AttendanceSequenceException;
import sp.sistemaspalacios.api_marcacion.exception.AttendanceUnavailableException;
import sp.sistemaspalacios.api_marcacion.exception.LocationValidationException;
import sp.sistemaspalacios.api_marcacion.exception.SequenceViolation;
import sp.sistemaspalacios.api_marcacion.repository.attendance.AttendanceRecordRepository;
import sp.sistemaspalacios.api_marcacion.service.location.LocationValidationService;
import sp.sistemaspalacios.api_marcacion.service.location.QrPayloadParser;
import sp.sistemaspalacios.api_marcacion.service.notification.NotificationService;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Attendance Marking Service Tests")
class AttendanceMarkingServiceTest {

    private static final String QR = "ACME|HR|C1|-12.0464,-77.0428|EST1|";
    private static final String EMAIL = "ana@empresa.pe";
    private static final CallerIdentity CALLER = new CallerIdentity(EMAIL, "Ana Torres", "45678912", null);
    // 13:00 UTC = 08:00 en Lima
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T13:00:00Z"), ZoneId.of("America/Lima"));
    private static final LocalDate TODAY = LocalDate.of(2026, 10, 19);
    private static final LocalTime NOW = LocalTime.of(8, 0);

    @Mock
    private LocationValidationService locationValidationService;
    @Mock
    private QrPayloadParser qrPayloadParser;
    @Mock
    private AttendanceSequencer sequencer;
    @Mock
    private AttendanceRecordRepository repository;
    @Mock
    private NotificationService notificationService;

    private AttendanceMarkingService service;

    @BeforeEach
    void setUp() {
        service = new AttendanceMarkingService(
                locationValidationService,
                qrPayloadParser,
                sequencer,
                new AttendanceLockManager(new MarkingProperties()),
                repository,
                notificationService,
                CLOCK);
    }

    private static MarkingRequest request(MarcationType type) {
        return new MarkingRequest(QR, type, -12.0464, -77.0428, 10.0);
    }

    private static ValidationReport report(boolean valid) {
        return ValidationReport.builder()
                .distanceMeters(valid ? 0.0 : 1500.0)
                .toleranceMeters(700.0)
                .withinTolerance(valid)
                .qrValid(true)
                .withinRegion(true)
                .accuracyAccepted(true)
                .overallValid(valid)
                .primaryIssue(valid ? "Validación exitosa" : "Muy lejos del punto de marcación")
                .errorCode(valid ? null : "DISTANCE_EXCEEDED")
                .build();
    }

    private static QrPayload payload() {
        return QrPayload.builder()
                .valid(true)
                .format(QrFormat.STANDARD)
                .company("ACME")
                .area("HR")
                .coordinates(Coordinate.of(-12.0464, -77.0428))
                .build();
    }

    private static AttendanceRecord stored() {
        AttendanceRecord record = new AttendanceRecord();
        record.setUserEmail(EMAIL);
        record.setAttendanceDate(TODAY);
        record.setEntryTime(NOW);
        record.setLocation("-12.0464, -77.0428");
        return record;
    }

    private void givenValidLocation() {
        when(locationValidationService.buildReport(any(Coordinate.class), eq(QR), eq(10.0))).thenReturn(report(true));
        when(qrPayloadParser.parse(QR)).thenReturn(payload());
    }

    @Nested
    @DisplayName("Successful marking")
    class Success {

        @Test
        void should_RegisterEntryAndNotify() {
            givenValidLocation();
            when(sequencer.apply(eq(CALLER), eq(MarcationType.ENTRY), eq(TODAY), eq(NOW), any(), any()))
                    .thenReturn(stored());

            MarkingResult result = service.mark(CALLER, request(MarcationType.ENTRY));

            assertEquals(MarcationType.ENTRY, result.getMarcationType());
            assertEquals(TODAY, result.getDate());
            assertEquals(NOW, result.getTime());
            assertEquals("-12.0464, -77.0428", result.getLocation());
            assertEquals("✅ Ingreso registrado exitosamente a las 08:00:00", result.getMessage());

            ArgumentCaptor<MarkingNotification> captor = ArgumentCaptor.forClass(MarkingNotification.class);
            verify(notificationService).sendMarkingNotification(captor.capture());
            MarkingNotification notification = captor.getValue();
            assertEquals("Ingreso", notification.getMarcationType());
            assertEquals("ACME", notification.getCompany());
            assertEquals("19/10/2026", notification.getDate());
            assertEquals("08:00:00", notification.getTime());
            assertEquals("45678912", notification.getUserDni());
        }

        @Test
        void should_NotNotify_When_BreakEvent() {
            givenValidLocation();
            when(sequencer.apply(any(), eq(MarcationType.BREAK_START), any(), any(), any(), any()))
                    .thenReturn(stored());

            service.mark(CALLER, request(MarcationType.BREAK_START));

            verifyNoInteractions(notificationService);
        }

        @Test
        void should_ReturnTodayRecord() {
            AttendanceRecord record = stored();
            record.setBreakStartTime(LocalTime.of(13, 0));
            when(repository.findByUserEmailAndAttendanceDate(EMAIL, TODAY)).thenReturn(Optional.of(record));

            TodayAttendanceDTO today = service.getToday(CALLER);

            assertEquals(TODAY, today.getDate());
            assertEquals(NOW, today.getEntryTime());
            assertEquals(LocalTime.of(13, 0), today.getBreakStartTime());
            assertNull(today.getExitTime());
        }

        @Test
        void should_ReturnEmptyDay_When_NoRecord() {
            when(repository.findByUserEmailAndAttendanceDate(EMAIL, TODAY)).thenReturn(Optional.empty());

            TodayAttendanceDTO today = service.getToday(CALLER);

            assertEquals(TODAY, today.getDate());
            assertNull(today.getEntryTime());
        }
    }

    @Nested
    @DisplayName("Rejected marking")
    class Rejected {

        @Test
        void should_PersistNothing_When_LocationInvalid() {
            when(locationValidationService.buildReport(any(Coordinate.class), eq(QR), eq(10.0))).thenReturn(report(false));

            LocationValidationException ex = assertThrows(LocationValidationException.class,
                    () -> service.mark(CALLER, request(MarcationType.ENTRY)));

            assertEquals("DISTANCE_EXCEEDED", ex.getReport().getErrorCode());
            verifyNoInteractions(sequencer, notificationService, qrPayloadParser);
        }

        @Test
        void should_PropagateSequenceViolation_WithoutNotifying() {
            givenValidLocation();
            when(sequencer.apply(any(), any(), any(), any(), any(), any()))
                    .thenThrow(new AttendanceSequenceException(SequenceViolation.ALREADY_ENTERED, LocalTime.of(7, 55)));

            AttendanceSequenceException ex = assertThrows(AttendanceSequenceException.class,
                    () -> service.mark(CALLER, request(MarcationType.ENTRY)));

            assertEquals(SequenceViolation.ALREADY_ENTERED, ex.getViolation());
            verifyNoInteractions(notificationService);
        }

        @Test
        void should_ReportAlreadyEntered_When_UniqueConstraintViolated() {
            givenValidLocation();
            when(sequencer.apply(any(), any(), any(), any(), any(), any()))
                    .thenThrow(new DataIntegrityViolationException("uk_attendance_user_date"));
            AttendanceRecord winner = stored();
            winner.setEntryTime(LocalTime.of(7, 59, 59));
            when(repository.findByUserEmailAndAttendanceDate(EMAIL, TODAY)).thenReturn(Optional.of(winner));

            AttendanceSequenceException ex = assertThrows(AttendanceSequenceException.class,
                    () -> service.mark(CALLER, request(MarcationType.ENTRY)));

            assertEquals(SequenceViolation.ALREADY_ENTERED, ex.getViolation());
            assertEquals(LocalTime.of(7, 59, 59), ex.getPreviousTime());
            verifyNoInteractions(notificationService);
        }

        @Test
        void should_ReportRetryable_When_StorageFails() {
            givenValidLocation();
            when(sequencer.apply(any(), any(), any(), any(), any(), any()))
                    .thenThrow(new PessimisticLockingFailureException("lock wait timeout"));

            assertThrows(AttendanceUnavailableException.class,
                    () -> service.mark(CALLER, request(MarcationType.EXIT)));

            verify(notificationService, never()).sendMarkingNotification(any());
            verify(repository, never()).findByUserEmailAndAttendanceDate(anyString(), any());
        }

        @Test
        void should_ReportRetryable_When_DatabaseConnectionUnavailable() {
            givenValidLocation();
            when(sequencer.apply(any(), any(), any(), any(), any(), any()))
                    .thenThrow(new CannotCreateTransactionException("Could not open JPA EntityManager for transaction"));

            AttendanceUnavailableException ex = assertThrows(AttendanceUnavailableException.class,
                    () -> service.mark(CALLER, request(MarcationType.ENTRY)));

            assertInstanceOf(CannotCreateTransactionException.class, ex.getCause());
            verifyNoInteractions(notificationService);
        }

        @Test
        void should_ReportRetryable_When_CommitFails() {
            givenValidLocation();
            when(sequencer.apply(any(), any(), any(), any(), any(), any()))
                    .thenThrow(new TransactionSystemException("Could not commit JPA transaction"));

            assertThrows(AttendanceUnavailableException.class,
                    () -> service.mark(CALLER, request(MarcationType.EXIT)));

            verifyNoInteractions(notificationService);
        }
    }
}

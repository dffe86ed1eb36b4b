package sp.sistemaspalacios.api_marcacion.service.attendance;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import sp.sistemaspalacios.api_marcacion.dto.attendance.CallerIdentity;
import sp.sistemaspalacios.api_marcacion.dto.attendance.MarkingNotification;
import sp.sistemaspalacios.api_marcacion.dto.attendance.MarkingRequest;
import sp.sistemaspalacios.api_marcacion.dto.attendance.MarkingResult;
import sp.sistemaspalacios.api_marcacion.dto.attendance.TodayAttendanceDTO;
import sp.sistemaspalacios.api_marcacion.dto.location.Coordinate;
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
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Flujo completo de una marcación: validación de ubicación, transición de
 * estado del día bajo candado y notificación de ingreso/salida.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AttendanceMarkingService {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yyyy");
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final LocationValidationService locationValidationService;
    private final QrPayloadParser qrPayloadParser;
    private final AttendanceSequencer sequencer;
    private final AttendanceLockManager lockManager;
    private final AttendanceRecordRepository repository;
    private final NotificationService notificationService;
    private final Clock clock;

    public MarkingResult mark(CallerIdentity caller, MarkingRequest request) {
        MarcationType type = request.getMarcationType();
        Coordinate userCoordinates = Coordinate.of(request.getLatitude(), request.getLongitude());

        log.info("🎯 Validando ubicación para {} de {}", type.getLabel(), caller.getEmail());

        ValidationReport report = locationValidationService.buildReport(
                userCoordinates, request.getQrCode(), request.getAccuracy());

        if (!report.isOverallValid()) {
            throw new LocationValidationException(report);
        }

        QrPayload qrPayload = qrPayloadParser.parse(request.getQrCode());

        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        LocalDate date = now.toLocalDate();
        LocalTime time = now.toLocalTime();

        AttendanceRecord record = lockManager.withLock(caller.getEmail(), date,
                () -> applyTransition(caller, type, date, time, userCoordinates, qrPayload));

        if (type.notifies()) {
            notificationService.sendMarkingNotification(MarkingNotification.builder()
                    .userName(caller.getName())
                    .userEmail(caller.getEmail())
                    .userDni(caller.getDni())
                    .marcationType(type.getLabel())
                    .company(qrPayload.getCompany())
                    .date(date.format(DATE_FORMAT))
                    .time(time.format(TIME_FORMAT))
                    .build());
        }

        return MarkingResult.builder()
                .marcationType(type)
                .date(date)
                .time(time)
                .location(record.getLocation())
                .message(String.format("✅ %s registrado exitosamente a las %s", type.getLabel(), time.format(TIME_FORMAT)))
                .report(report)
                .build();
    }

    public TodayAttendanceDTO getToday(CallerIdentity caller) {
        LocalDate today = LocalDate.now(clock);
        return repository.findByUserEmailAndAttendanceDate(caller.getEmail(), today)
                .map(TodayAttendanceDTO::from)
                .orElseGet(() -> TodayAttendanceDTO.empty(today));
    }

    private AttendanceRecord applyTransition(
            CallerIdentity caller,
            MarcationType type,
            LocalDate date,
            LocalTime time,
            Coordinate coordinate,
            QrPayload qrPayload
    ) {
        try {
            return sequencer.apply(caller, type, date, time, coordinate, qrPayload);

        } catch (DataIntegrityViolationException e) {
            // Otra instancia insertó el ingreso del día primero
            log.warn("⚠️ Ingreso concurrente detectado para {} el {}", caller.getEmail(), date);
            LocalTime previousEntry = repository.findByUserEmailAndAttendanceDate(caller.getEmail(), date)
                    .map(AttendanceRecord::getEntryTime)
                    .orElse(null);
            throw new AttendanceSequenceException(SequenceViolation.ALREADY_ENTERED, previousEntry);

        } catch (DataAccessException | TransactionException e) {
            // Conexión caída, bloqueo de fila vencido o commit fallido: nada quedó registrado
            log.error("❌ Error de almacenamiento registrando marcación: {}", e.getMessage(), e);
            throw new AttendanceUnavailableException("Error temporal al registrar la marcación, intente nuevamente", e);
        }
    }
}

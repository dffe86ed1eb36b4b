package sp.sistemaspalacios.api_marcacion.service.attendance;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_marcacion.dto.attendance.CallerIdentity;
import sp.sistemaspalacios.api_marcacion.dto.location.Coordinate;
import sp.sistemaspalacios.api_marcacion.dto.location.QrPayload;
import sp.sistemaspalacios.api_marcacion.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.api_marcacion.entity.attendance.MarcationType;
import sp.sistemaspalacios.api_marcacion.exception.AttendanceSequenceException;
import sp.sistemaspalacios.api_marcacion.exception.SequenceViolation;
import sp.sistemaspalacios.api_marcacion.repository.attendance.AttendanceRecordRepository;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Optional;

/**
 * Máquina de estados del día: Ingreso -> (Inicio -> Fin de refrigerio) -> Salida.
 * Es el único que escribe {@link AttendanceRecord}. Las precondiciones se
 * verifican antes de tocar el registro, así un rechazo nunca lo modifica.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AttendanceSequencer {

    private final AttendanceRecordRepository repository;

    @Transactional
    public AttendanceRecord apply(
            CallerIdentity caller,
            MarcationType type,
            LocalDate date,
            LocalTime time,
            Coordinate coordinate,
            QrPayload qrPayload
    ) {
        Optional<AttendanceRecord> existing = repository.findForUpdate(caller.getEmail(), date);

        AttendanceRecord record;
        if (type == MarcationType.ENTRY) {
            record = applyEntry(existing, caller, date, time);
        } else {
            record = existing
                    .filter(r -> r.getEntryTime() != null)
                    .orElseThrow(() -> new AttendanceSequenceException(SequenceViolation.NOT_ENTERED));

            switch (type) {
                case BREAK_START:
                    applyBreakStart(record, time);
                    break;
                case BREAK_END:
                    applyBreakEnd(record, time);
                    break;
                case EXIT:
                    applyExit(record, time);
                    break;
                default:
                    throw new IllegalArgumentException("Tipo de marcación no soportado: " + type);
            }
        }

        // Cada marcación registra dónde ocurrió
        record.setLatitude(coordinate.getLatitude());
        record.setLongitude(coordinate.getLongitude());
        record.setLocation(coordinate.toLocationString());
        if (qrPayload != null && qrPayload.isValid()) {
            record.setCompany(qrPayload.getCompany());
            record.setArea(qrPayload.getArea());
        }

        AttendanceRecord saved = repository.saveAndFlush(record);
        log.info("✅ Marcación '{}' registrada para {} a las {}", type.getLabel(), caller.getEmail(), time);
        return saved;
    }

    private AttendanceRecord applyEntry(
            Optional<AttendanceRecord> existing,
            CallerIdentity caller,
            LocalDate date,
            LocalTime time
    ) {
        if (existing.isPresent() && existing.get().getEntryTime() != null) {
            throw new AttendanceSequenceException(SequenceViolation.ALREADY_ENTERED, existing.get().getEntryTime());
        }

        AttendanceRecord record = existing.orElseGet(() -> newRecord(caller, date));
        record.setEntryTime(time);
        return record;
    }

    private void applyBreakStart(AttendanceRecord record, LocalTime time) {
        if (record.getExitTime() != null) {
            throw new AttendanceSequenceException(SequenceViolation.ALREADY_EXITED, record.getExitTime());
        }
        if (record.getBreakStartTime() != null) {
            throw new AttendanceSequenceException(SequenceViolation.DUPLICATE_BREAK_START, record.getBreakStartTime());
        }
        record.setBreakStartTime(time);
    }

    private void applyBreakEnd(AttendanceRecord record, LocalTime time) {
        if (record.getExitTime() != null) {
            throw new AttendanceSequenceException(SequenceViolation.ALREADY_EXITED, record.getExitTime());
        }
        if (record.getBreakStartTime() == null) {
            throw new AttendanceSequenceException(SequenceViolation.BREAK_NOT_STARTED);
        }
        if (record.getBreakEndTime() != null) {
            throw new AttendanceSequenceException(SequenceViolation.DUPLICATE_BREAK_END, record.getBreakEndTime());
        }
        record.setBreakEndTime(time);
    }

    private void applyExit(AttendanceRecord record, LocalTime time) {
        if (record.getBreakStartTime() != null && record.getBreakEndTime() == null) {
            throw new AttendanceSequenceException(SequenceViolation.BREAK_NOT_FINISHED);
        }
        if (record.getExitTime() != null) {
            throw new AttendanceSequenceException(SequenceViolation.DUPLICATE_EXIT, record.getExitTime());
        }
        record.setExitTime(time);
    }

    private static AttendanceRecord newRecord(CallerIdentity caller, LocalDate date) {
        AttendanceRecord record = new AttendanceRecord();
        record.setUserEmail(caller.getEmail());
        record.setUserName(caller.getName());
        record.setUserDni(caller.getDni());
        record.setDeviceId(caller.getDeviceId());
        record.setAttendanceDate(date);
        return record;
    }
}

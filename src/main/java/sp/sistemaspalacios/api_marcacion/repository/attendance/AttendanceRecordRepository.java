package sp.sistemaspalacios.api_marcacion.repository.attendance;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_marcacion.entity.attendance.AttendanceRecord;

import java.time.LocalDate;
import java.util.Optional;

@Repository
public interface AttendanceRecordRepository extends JpaRepository<AttendanceRecord, Long> {

    Optional<AttendanceRecord> findByUserEmailAndAttendanceDate(String userEmail, LocalDate attendanceDate);

    /**
     * Lee el registro del día bloqueando la fila hasta el fin de la transacción.
     * La espera máxima la fija {@code jakarta.persistence.lock.timeout}, que en
     * application.properties sale de {@code attendance.marking.lock-timeout-ms}.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM AttendanceRecord r " +
            "WHERE r.userEmail = :userEmail " +
            "AND r.attendanceDate = :attendanceDate")
    Optional<AttendanceRecord> findForUpdate(
            @Param("userEmail") String userEmail,
            @Param("attendanceDate") LocalDate attendanceDate
    );
}

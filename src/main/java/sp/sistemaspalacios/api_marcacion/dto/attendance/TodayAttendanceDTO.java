package sp.sistemaspalacios.api_marcacion.dto.attendance;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Data;
import sp.sistemaspalacios.api_marcacion.entity.attendance.AttendanceRecord;

import java.time.LocalDate;
import java.time.LocalTime;

@Data
@Builder
public class TodayAttendanceDTO {

    private LocalDate date;

    @JsonFormat(pattern = "HH:mm:ss")
    private LocalTime entryTime;

    @JsonFormat(pattern = "HH:mm:ss")
    private LocalTime breakStartTime;

    @JsonFormat(pattern = "HH:mm:ss")
    private LocalTime breakEndTime;

    @JsonFormat(pattern = "HH:mm:ss")
    private LocalTime exitTime;

    private String location;

    public static TodayAttendanceDTO empty(LocalDate date) {
        return TodayAttendanceDTO.builder().date(date).build();
    }

    public static TodayAttendanceDTO from(AttendanceRecord record) {
        return TodayAttendanceDTO.builder()
                .date(record.getAttendanceDate())
                .entryTime(record.getEntryTime())
                .breakStartTime(record.getBreakStartTime())
                .breakEndTime(record.getBreakEndTime())
                .exitTime(record.getExitTime())
                .location(record.getLocation())
                .build();
    }
}

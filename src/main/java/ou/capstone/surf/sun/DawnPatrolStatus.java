package ou.capstone.surf.sun;

import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Where the user stands relative to a first-light session.
 */
public final class DawnPatrolStatus {

    public enum Status {
        TOO_EARLY("too-early"),
        LEAVE_NOW("leave-now"),
        ON_THE_WAY("on-the-way"),
        SURFING("surfing"),
        MISSED("missed");

        private final String label;

        Status(final String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final Status status;
    private final String message;
    private final ZonedDateTime leaveBy;

    public DawnPatrolStatus(final Status status, final String message, final ZonedDateTime leaveBy) {
        this.status = Objects.requireNonNull(status, "status is required");
        this.message = Objects.requireNonNull(message, "message is required");
        this.leaveBy = leaveBy;
    }

    public Status getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    /** Departure time, present only when a drive estimate was known. */
    public Optional<ZonedDateTime> getLeaveBy() {
        return Optional.ofNullable(leaveBy);
    }

    @Override
    public String toString() {
        return status.label() + ": " + message;
    }
}

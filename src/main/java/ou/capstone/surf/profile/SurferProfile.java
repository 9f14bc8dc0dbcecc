package ou.capstone.surf.profile;

import java.util.Objects;

/**
 * Board class and skill level pair used to look up preferred wave sizes.
 */
public record SurferProfile(BoardType board, SkillLevel skill) {

    public SurferProfile {
        Objects.requireNonNull(board, "board is required");
        Objects.requireNonNull(skill, "skill is required");
    }

    /** Parses both halves from user/config strings. */
    public static SurferProfile of(final String board, final String skill) {
        return new SurferProfile(BoardType.parse(board), SkillLevel.parse(skill));
    }

    @Override
    public String toString() {
        return skill.label() + " " + board.label();
    }
}

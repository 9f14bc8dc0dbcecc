package ou.capstone.surf.tide;

/** Where the tide is in its cycle right now. */
public enum TidePhase {
    RISING, FALLING, HIGH, LOW
}

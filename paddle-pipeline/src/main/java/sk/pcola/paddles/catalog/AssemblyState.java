package sk.pcola.paddles.catalog;

/**
 * Životný cyklus spracovania jednej stránky. Prechody idú len dopredu,
 * ASSEMBLED a REJECTED sú koncové.
 */
public enum AssemblyState {
    FETCHED,
    FIELDS_RESOLVED,
    NORMALIZED,
    ASSEMBLED,
    REJECTED;

    public boolean canTransitionTo(AssemblyState next) {
        return switch (this) {
            case FETCHED -> next == FIELDS_RESOLVED || next == REJECTED;
            case FIELDS_RESOLVED -> next == NORMALIZED || next == REJECTED;
            case NORMALIZED -> next == ASSEMBLED || next == REJECTED;
            case ASSEMBLED, REJECTED -> false;
        };
    }

    /**
     * @throws IllegalStateException pri neplatnom prechode (chyba v kóde, nie v dátach)
     */
    public AssemblyState transitionTo(AssemblyState next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException("Illegal assembly transition " + this + " -> " + next);
        }
        return next;
    }

    public boolean isTerminal() {
        return this == ASSEMBLED || this == REJECTED;
    }
}

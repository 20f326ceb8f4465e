package sk.pcola.paddles.catalog;

import java.util.List;

/**
 * Názvy polí, ktoré profily obchodov deklarujú a assembler číta.
 */
public final class PaddleFields {

    public static final String TITLE = "title";
    public static final String BRAND = "brand";
    public static final String DESCRIPTION = "description";
    public static final String IMAGE = "image";
    public static final String SHAPE = "shape";

    public static final String SURFACE = "surface";
    public static final String AVERAGE_WEIGHT = "average_weight";
    public static final String CORE = "core";
    public static final String PADDLE_LENGTH = "paddle_length";
    public static final String PADDLE_WIDTH = "paddle_width";
    public static final String GRIP_LENGTH = "grip_length";
    public static final String GRIP_TYPE = "grip_type";
    public static final String GRIP_CIRCUMFERENCE = "grip_circumference";

    public static final String POWER = "power";
    public static final String POP = "pop";
    public static final String SPIN = "spin";
    public static final String TWIST_WEIGHT = "twist_weight";
    public static final String SWING_WEIGHT = "swing_weight";
    public static final String BALANCE_POINT = "balance_point";

    /**
     * Polia špecifikácie, ktorých absencia sa hlási v diagnostike.
     * Výkonnostné hodnotenia väčšina obchodov neuvádza, tie sa nehlásia.
     */
    public static final List<String> REPORTED_SPECS = List.of(
            SURFACE, AVERAGE_WEIGHT, CORE, PADDLE_LENGTH, PADDLE_WIDTH,
            GRIP_LENGTH, GRIP_TYPE, GRIP_CIRCUMFERENCE
    );

    private PaddleFields() {
    }
}

package com.viffx.Slr.Compiler;

/**
 * A cell of the SLR(1) parse table.
 * <p>
 * The meaning of {@code data} depends on the action type:
 * <ul>
 *   <li>For {@link ActionType#SHIFT},  {@code data} is the state pushed after consuming the token.</li>
 *   <li>For {@link ActionType#GOTO},   {@code data} is the state pushed after a reduction.</li>
 *   <li>For {@link ActionType#REDUCE}, {@code data} is the production to reduce by.</li>
 *   <li>For {@link ActionType#ACCEPT}, {@code data} is unused and always zero.</li>
 * </ul>
 *
 * @param type the kind of action
 * @param data a state or production index, see above
 */
public record Action(ActionType type, int data) {
    public static final Action ACCEPT = new Action(ActionType.ACCEPT, 0);

    public static Action shift(int state) {
        return new Action(ActionType.SHIFT, state);
    }

    public static Action reduce(int production) {
        return new Action(ActionType.REDUCE, production);
    }

    public static Action goTo(int state) {
        return new Action(ActionType.GOTO, state);
    }

    @Override
    public String toString() {
        return switch (type) {
            case SHIFT -> "s" + data;
            case REDUCE -> "r" + data;
            case GOTO -> "g" + data;
            case ACCEPT -> "acc";
        };
    }
}

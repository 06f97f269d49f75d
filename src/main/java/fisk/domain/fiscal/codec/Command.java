package fisk.domain.fiscal.codec;

/**
 * One protocol command: opcode plus vendor formatted payload text
 * @since 15/10/2026
 */
public record Command(byte opcode, String payload) {

    public Command {
        if (payload == null) {
            payload = "";
        }
    }

    public static Command of(byte opcode) {
        return new Command(opcode, "");
    }

    @Override
    public String toString() {
        return String.format("Command{opcode=0x%02X, payload='%s'}", opcode & 0xFF, payload);
    }
}

package logsim.ast;

/** {@code device} or {@code device.PIN}; {@code pin} is null in the first form. */
public record PinRef(Ident device, Ident pin) {

    public String text() {
        return pin == null ? device.text() : device.text() + "." + pin.text();
    }
}

package dev.ticketing.ticket.model;

/**
 * Contact details of whoever raised the ticket. Every field is optional.
 */
public record SenderInfo(String email, String name, String phone, String company) {

    private static final SenderInfo EMPTY = new SenderInfo(null, null, null, null);

    public static SenderInfo empty() {
        return EMPTY;
    }

    public static SenderInfo ofEmail(String email) {
        return new SenderInfo(email, null, null, null);
    }

    public boolean isEmpty() {
        return email == null && name == null && phone == null && company == null;
    }
}

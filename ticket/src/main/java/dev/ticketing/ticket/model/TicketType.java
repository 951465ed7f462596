package dev.ticketing.ticket.model;

/**
 * Business classification of a ticket. The label is also the wire name.
 */
public enum TicketType {
    RETURN("Return"),
    SHIPPING_ISSUE("Shipping Issue"),
    ORDER_ISSUE("Order Issue"),
    NEW_ORDER("New Order"),
    CREDIT_REQUEST("Credit Request"),
    COA_REQUEST("COA Request"),
    COC_REQUEST("COC Request"),
    SDS_REQUEST("SDS Request"),
    QUOTE_REQUEST("Quote Request"),
    PURCHASE_ORDER("Purchase Order"),
    GENERAL_INQUIRY("General Inquiry"),
    TEST_ENTRY("Test Entry"),
    INTERNATIONAL_SHIPPING("International Shipping");

    private final String label;

    TicketType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static TicketType fromLabel(String label) {
        for (TicketType type : values()) {
            if (type.label.equals(label)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown ticket type: " + label);
    }
}

package dev.ticketing.ticket.model;

/**
 * Shipping address captured from an inbound request. Every field is optional.
 */
public record ShippingAddress(
    String name,
    String company,
    String country,
    String addressLine1,
    String addressLine2,
    String addressLine3,
    String city,
    String state,
    String postalCode,
    String phone,
    String email
) {
}

package io.b2mash.b2b.commercial.customer;

import java.util.Optional;
import java.util.UUID;

/** Resolves customer ids to display data. Owned by the customer directory, opaque here. */
public interface CustomerDirectory {

  Optional<CustomerSummary> findCustomer(UUID customerId);
}

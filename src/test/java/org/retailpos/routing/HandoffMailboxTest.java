package org.retailpos.routing;

import org.junit.jupiter.api.Test;
import org.retailpos.domain.Product;

import static org.assertj.core.api.Assertions.assertThat;

class HandoffMailboxTest {

    private final Product noodles = Product.builder().id("P-001").name("Instant Noodles").quantity(5).build();

    @Test
    void payloadIsConsumedAtMostOnce() {
        HandoffMailbox mailbox = new HandoffMailbox(1000);
        mailbox.offer(noodles);

        assertThat(mailbox.consume(0)).contains(noodles);
        assertThat(mailbox.hasPending()).isFalse();
        assertThat(mailbox.consume(10)).isEmpty();
    }

    @Test
    void duplicateDeliveryInsideGraceWindowIsIgnored() {
        HandoffMailbox mailbox = new HandoffMailbox(1000);
        mailbox.offer(noodles);
        mailbox.consume(0);

        mailbox.offer(noodles);
        assertThat(mailbox.consume(999)).isEmpty();
        assertThat(mailbox.hasPending()).isFalse();

        mailbox.offer(noodles);
        assertThat(mailbox.consume(2000)).contains(noodles);
    }

    @Test
    void differentProductIsNotAffectedByGraceWindow() {
        HandoffMailbox mailbox = new HandoffMailbox(1000);
        mailbox.offer(noodles);
        mailbox.consume(0);

        Product water = Product.builder().id("P-002").name("Bottled Water").quantity(5).build();
        mailbox.offer(water);
        assertThat(mailbox.consume(10)).contains(water);
    }
}

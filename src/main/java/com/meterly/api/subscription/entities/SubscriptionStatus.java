package com.meterly.api.subscription.entities;

import lombok.NonNull;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * <p>
 * Lifecycle states of a {@link Subscription}. An organisation without a subscription record is
 * in the implicit {@code none} state.</p>
 *
 * <pre>
 *     none -&gt; trialing -&gt; active &lt;-&gt; past_due
 *     trialing | active | past_due -&gt; canceled
 * </pre>
 *
 * <p>
 * {@link #CANCELED} is terminal: a canceled record is kept for history and never moves to another
 * state.</p>
 *
 * <p>
 * Since an organisation owns at most one record, a later checkout of a canceled organisation
 * reuses the canceled row for a new lifecycle that starts again from {@code none}. The Stripe
 * subscription id, items and status of the old lifecycle are overwritten, and the change is
 * recorded in the subscription log. This isn't a transition out of {@link #CANCELED}, and {@link
 * #canTransitionTo(SubscriptionStatus)} still rejects one.</p>
 */
public enum SubscriptionStatus {
    TRIALING,
    ACTIVE,
    PAST_DUE,
    CANCELED;

    /**
     * @return whether a subscription may move from this state to {@code next}. Staying in the same
     * state is always allowed.
     */
    public boolean canTransitionTo(@NonNull SubscriptionStatus next) {
        return next == this || allowedTargets().contains(next);
    }

    /**
     * @return whether a subscription in this state grants access to the subscribed plan.
     */
    public boolean isEntitling() {
        return this != CANCELED;
    }

    /**
     * @return lowercase name as used in API responses, e.g. {@code past_due}.
     */
    @NonNull
    public String getValue() {
        return name().toLowerCase();
    }

    /**
     * Maps a Stripe subscription status to a local status. Stripe statuses without a local
     * counterpart, e.g. {@code incomplete}, {@code unpaid} or {@code paused}, map to an empty
     * {@link Optional}.
     */
    @NonNull
    public static Optional<SubscriptionStatus> fromStripeStatus(String stripeStatus) {
        if (stripeStatus == null) {
            return Optional.empty();
        }

        switch (stripeStatus) {
            case "trialing":
                return Optional.of(TRIALING);
            case "active":
                return Optional.of(ACTIVE);
            case "past_due":
                return Optional.of(PAST_DUE);
            case "canceled":
                return Optional.of(CANCELED);
            default:
                return Optional.empty();
        }
    }

    @NonNull
    private Set<SubscriptionStatus> allowedTargets() {
        switch (this) {
            case TRIALING:
                return EnumSet.of(ACTIVE, PAST_DUE, CANCELED);
            case ACTIVE:
            case PAST_DUE:
                return EnumSet.of(ACTIVE, PAST_DUE, CANCELED);
            default:
                return EnumSet.noneOf(SubscriptionStatus.class);
        }
    }
}

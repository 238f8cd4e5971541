package com.meterly.api.subscription;

import com.meterly.api.contracts.CatalogServiceContract;
import com.meterly.api.contracts.CatalogSnapshot;
import com.meterly.api.contracts.SubscriptionItem;
import com.meterly.api.subscription.entities.Subscription;
import com.meterly.api.subscription.entities.SubscriptionLog;
import com.meterly.api.subscription.entities.SubscriptionLogRepository;
import com.meterly.api.subscription.entities.SubscriptionRepository;
import com.meterly.api.subscription.entities.SubscriptionStatus;
import com.meterly.api.subscription.entities.TrialStatus;
import com.meterly.api.subscription.entities.TrialStatusRepository;
import com.meterly.api.subscription.exceptions.WebhookEventException;
import com.meterly.api.subscription.exceptions.WebhookPayloadException;
import com.meterly.api.subscription.upstream.StripeApi;
import com.stripe.exception.ApiConnectionException;
import com.stripe.exception.StripeException;
import com.stripe.model.Invoice;
import com.stripe.model.Price;
import com.stripe.model.SubscriptionItemCollection;
import com.stripe.model.checkout.Session;
import lombok.NonNull;
import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.cache.Cache;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.params.provider.Arguments.arguments;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class SubscriptionStateMachineTest {

    private static final String ORG_ID = "org-1";
    private static final String USER_ID = "user-1";
    private static final String STRIPE_SUBSCRIPTION_ID = "sub_1";

    private static final CatalogSnapshot CATALOG = CatalogSnapshot.of(
        List.of(
            CatalogSnapshot.Plan.builder()
                .key("basic")
                .name("Basic")
                .stripePriceId("price_basic")
                .status(CatalogSnapshot.Status.ACTIVE)
                .trialDurationDays(14)
                .build()),
        List.of(
            CatalogSnapshot.Module.builder()
                .key("sms")
                .name("SMS")
                .stripePriceId("price_sms")
                .status(CatalogSnapshot.Status.ACTIVE)
                .allowMultiple(true)
                .build()),
        OffsetDateTime.now());

    @Mock
    private SubscriptionRepository subscriptionRepository;

    @Mock
    private TrialStatusRepository trialStatusRepository;

    @Mock
    private SubscriptionLogRepository subscriptionLogRepository;

    @Mock
    private CatalogServiceContract catalogServiceContract;

    @Mock
    private StripeApi stripeApi;

    @Mock
    private Cache cache;

    private SubscriptionStateMachine stateMachine;

    @BeforeEach
    void setUp() {
        stateMachine = new SubscriptionStateMachine(
            subscriptionRepository,
            trialStatusRepository,
            subscriptionLogRepository,
            catalogServiceContract,
            stripeApi,
            cache);

        lenient().when(catalogServiceContract.getSnapshot()).thenReturn(CATALOG);
        lenient().when(subscriptionRepository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void onCheckoutCompleted_withNewSubscription() throws Exception {
        when(stripeApi.getSubscription(STRIPE_SUBSCRIPTION_ID))
            .thenReturn(buildStripeSubscription("active", Map.of("price_basic", 1L, "price_sms", 3L)));

        when(subscriptionRepository.findByOrgIdForUpdate(ORG_ID)).thenReturn(Optional.empty());

        stateMachine.onCheckoutCompleted(buildSession("[\"sms\",\"sms\",\"sms\"]"));

        val captor = ArgumentCaptor.forClass(Subscription.class);
        verify(subscriptionRepository, times(1)).save(captor.capture());
        val saved = captor.getValue();
        assertEquals(ORG_ID, saved.getOrgId());
        assertEquals(USER_ID, saved.getPayerId());
        assertEquals(SubscriptionStatus.ACTIVE, saved.getStatus());
        assertEquals(STRIPE_SUBSCRIPTION_ID, saved.getStripeSubscriptionId());
        assertEquals("cus_1", saved.getStripeCustomerId());
        assertEquals(List.of(
            SubscriptionItem.plan("basic", "Basic", "price_basic"),
            SubscriptionItem.module("sms", "SMS", "price_sms", 3)), saved.getItems());

        verify(trialStatusRepository, never()).save(any());
        verify(cache, times(1)).evictIfPresent("isSubscribed:" + ORG_ID);
        assertEquals("checkout_completed", captureLog().getAction());
    }

    @Test
    void onCheckoutCompleted_withTrial() throws Exception {
        when(stripeApi.getSubscription(STRIPE_SUBSCRIPTION_ID))
            .thenReturn(buildStripeSubscription("trialing", Map.of("price_basic", 1L)));

        when(subscriptionRepository.findByOrgIdForUpdate(ORG_ID)).thenReturn(Optional.empty());
        when(trialStatusRepository.findById(USER_ID)).thenReturn(Optional.empty());

        stateMachine.onCheckoutCompleted(buildSession(null));

        val captor = ArgumentCaptor.forClass(TrialStatus.class);
        verify(trialStatusRepository, times(1)).save(captor.capture());
        assertTrue(captor.getValue().isHasUsedTrial());
        assertNotNull(captor.getValue().getTrialActivatedAt());
        assertTrue(captor.getValue().getInitialTrialOrgIds().contains(ORG_ID));
    }

    @Test
    void onCheckoutCompleted_withCanceledSubscription() throws Exception {
        val canceled = buildSubscription(SubscriptionStatus.CANCELED, "sub_old");
        canceled.setCanceledAt(OffsetDateTime.now().minusDays(3));
        when(stripeApi.getSubscription(STRIPE_SUBSCRIPTION_ID))
            .thenReturn(buildStripeSubscription("active", Map.of("price_basic", 1L)));

        when(subscriptionRepository.findByOrgIdForUpdate(ORG_ID)).thenReturn(Optional.of(canceled));

        stateMachine.onCheckoutCompleted(buildSession(null));

        verify(subscriptionRepository, times(1)).save(canceled);
        assertEquals(SubscriptionStatus.ACTIVE, canceled.getStatus());
        assertEquals(STRIPE_SUBSCRIPTION_ID, canceled.getStripeSubscriptionId());
        assertEquals(null, canceled.getCanceledAt());

        // the row starts a new lifecycle; canceled itself stays terminal.
        val logEntry = captureLog();
        assertEquals("checkout_completed", logEntry.getAction());
        assertEquals("none", logEntry.getMetadata().get("previousStatus"));
        assertFalse(SubscriptionStatus.CANCELED.canTransitionTo(SubscriptionStatus.ACTIVE));
    }

    @Test
    void onCheckoutCompleted_withDuplicateCheckout() throws Exception {
        val existing = buildSubscription(SubscriptionStatus.ACTIVE, "sub_other");
        when(stripeApi.getSubscription(STRIPE_SUBSCRIPTION_ID))
            .thenReturn(buildStripeSubscription("active", Map.of("price_basic", 1L)));

        when(subscriptionRepository.findByOrgIdForUpdate(ORG_ID)).thenReturn(Optional.of(existing));

        stateMachine.onCheckoutCompleted(buildSession(null));

        verify(stripeApi, times(1)).refundSubscription(STRIPE_SUBSCRIPTION_ID);
        verify(subscriptionRepository, never()).save(any());
        assertEquals("sub_other", existing.getStripeSubscriptionId());
        assertEquals("duplicate_checkout_refunded", captureLog().getAction());
    }

    @Test
    void onCheckoutCompleted_withRedeliveredCheckout() throws Exception {
        val existing = buildSubscription(SubscriptionStatus.ACTIVE, STRIPE_SUBSCRIPTION_ID);
        when(stripeApi.getSubscription(STRIPE_SUBSCRIPTION_ID))
            .thenReturn(buildStripeSubscription("active", Map.of("price_basic", 1L)));

        when(subscriptionRepository.findByOrgIdForUpdate(ORG_ID)).thenReturn(Optional.of(existing));

        stateMachine.onCheckoutCompleted(buildSession(null));

        verify(stripeApi, never()).refundSubscription(any());
        verify(subscriptionRepository, times(1)).save(existing);
        assertEquals(SubscriptionStatus.ACTIVE, existing.getStatus());
    }

    @ParameterizedTest(name = "{index} {0}")
    @MethodSource("onCheckoutCompleted_withInvalidSessionTestCases")
    void onCheckoutCompleted_withInvalidSession(String name, Session session) throws StripeException {
        assertThrows(WebhookPayloadException.class, () -> stateMachine.onCheckoutCompleted(session));
        verify(stripeApi, never()).getSubscription(any());
        verify(subscriptionRepository, never()).save(any());
    }

    static Stream<Arguments> onCheckoutCompleted_withInvalidSessionTestCases() {
        val paymentMode = buildSession(null);
        paymentMode.setMode("payment");

        val open = buildSession(null);
        open.setStatus("open");

        val withoutSubscription = buildSession(null);
        withoutSubscription.setSubscription(null);

        val withoutOrgId = buildSession(null);
        withoutOrgId.getMetadata().remove(SubscriptionStateMachine.METADATA_ORG_ID);

        val withMalformedModuleKeys = buildSession("{\"sms\": 1}");

        return Stream.of(
            arguments("payment mode", paymentMode),
            arguments("open session", open),
            arguments("missing subscription", withoutSubscription),
            arguments("missing org id", withoutOrgId),
            arguments("malformed module keys", withMalformedModuleKeys)
        );
    }

    @Test
    void onCheckoutCompleted_withStripeApiError() throws StripeException {
        when(stripeApi.getSubscription(STRIPE_SUBSCRIPTION_ID)).thenThrow(new ApiConnectionException("test-error"));
        assertThrows(WebhookEventException.class, () -> stateMachine.onCheckoutCompleted(buildSession(null)));
        verify(subscriptionRepository, never()).save(any());
    }

    @Test
    void onCheckoutCompleted_withUnknownPrice() throws Exception {
        when(stripeApi.getSubscription(STRIPE_SUBSCRIPTION_ID))
            .thenReturn(buildStripeSubscription("active", Map.of("price_gone", 2L)));

        when(subscriptionRepository.findByOrgIdForUpdate(ORG_ID)).thenReturn(Optional.empty());

        stateMachine.onCheckoutCompleted(buildSession(null));

        val captor = ArgumentCaptor.forClass(Subscription.class);
        verify(subscriptionRepository, times(1)).save(captor.capture());
        assertEquals(List.of(
            SubscriptionItem.plan("basic", "Basic", "price_basic"),
            SubscriptionItem.module("unknown_price_gone", "unknown_price_gone", "price_gone", 2)), captor.getValue().getItems());
    }

    @ParameterizedTest(name = "{index} {0} -> {1}")
    @MethodSource("onSubscriptionUpdatedTestCases")
    void onSubscriptionUpdated(
        SubscriptionStatus currentStatus,
        String stripeStatus,
        SubscriptionStatus expectedStatus,
        boolean isSaved
    ) throws Exception {
        val subscription = buildSubscription(currentStatus, STRIPE_SUBSCRIPTION_ID);
        when(stripeApi.getSubscription(STRIPE_SUBSCRIPTION_ID))
            .thenReturn(buildStripeSubscription(stripeStatus, Map.of("price_basic", 1L, "price_sms", 5L)));

        when(subscriptionRepository.findByStripeSubscriptionIdForUpdate(STRIPE_SUBSCRIPTION_ID))
            .thenReturn(Optional.of(subscription));

        stateMachine.onSubscriptionUpdated(STRIPE_SUBSCRIPTION_ID);

        assertEquals(expectedStatus, subscription.getStatus());
        verify(subscriptionRepository, times(isSaved ? 1 : 0)).save(subscription);
        if (isSaved) {
            assertEquals(2, subscription.getItems().size());
            assertEquals(5, subscription.getItems().get(1).getQuantity());
        }
    }

    static Stream<Arguments> onSubscriptionUpdatedTestCases() {
        return Stream.of(
            // current status, stripe status, expected status, is saved
            arguments(SubscriptionStatus.TRIALING, "active", SubscriptionStatus.ACTIVE, true),
            arguments(SubscriptionStatus.ACTIVE, "past_due", SubscriptionStatus.PAST_DUE, true),
            arguments(SubscriptionStatus.PAST_DUE, "active", SubscriptionStatus.ACTIVE, true),
            arguments(SubscriptionStatus.ACTIVE, "active", SubscriptionStatus.ACTIVE, true),
            arguments(SubscriptionStatus.ACTIVE, "canceled", SubscriptionStatus.CANCELED, true),
            arguments(SubscriptionStatus.ACTIVE, "trialing", SubscriptionStatus.ACTIVE, false),
            arguments(SubscriptionStatus.ACTIVE, "incomplete", SubscriptionStatus.ACTIVE, false),
            arguments(SubscriptionStatus.CANCELED, "active", SubscriptionStatus.CANCELED, false)
        );
    }

    @Test
    void onSubscriptionCreated_withUnknownSubscription() throws Exception {
        val stripeSubscription = buildStripeSubscription("trialing", Map.of("price_basic", 1L));
        stripeSubscription.setMetadata(Map.of(
            SubscriptionStateMachine.METADATA_ORG_ID, ORG_ID,
            SubscriptionStateMachine.METADATA_USER_ID, USER_ID,
            SubscriptionStateMachine.METADATA_PLAN_KEY, "basic"));

        when(stripeApi.getSubscription(STRIPE_SUBSCRIPTION_ID)).thenReturn(stripeSubscription);
        when(subscriptionRepository.findByStripeSubscriptionIdForUpdate(STRIPE_SUBSCRIPTION_ID)).thenReturn(Optional.empty());
        when(subscriptionRepository.findByOrgIdForUpdate(ORG_ID)).thenReturn(Optional.empty());

        stateMachine.onSubscriptionCreated(STRIPE_SUBSCRIPTION_ID);

        val captor = ArgumentCaptor.forClass(Subscription.class);
        verify(subscriptionRepository, times(1)).save(captor.capture());
        assertEquals(ORG_ID, captor.getValue().getOrgId());
        assertEquals(USER_ID, captor.getValue().getPayerId());
        assertEquals(SubscriptionStatus.TRIALING, captor.getValue().getStatus());
        assertEquals("subscription_created", captureLog().getAction());
    }

    @Test
    void onSubscriptionCreated_withoutOrgMetadata() throws Exception {
        when(stripeApi.getSubscription(STRIPE_SUBSCRIPTION_ID))
            .thenReturn(buildStripeSubscription("active", Map.of("price_basic", 1L)));

        when(subscriptionRepository.findByStripeSubscriptionIdForUpdate(STRIPE_SUBSCRIPTION_ID)).thenReturn(Optional.empty());

        stateMachine.onSubscriptionCreated(STRIPE_SUBSCRIPTION_ID);
        verify(subscriptionRepository, never()).save(any());
    }

    @Test
    void onSubscriptionDeleted() {
        val subscription = buildSubscription(SubscriptionStatus.ACTIVE, STRIPE_SUBSCRIPTION_ID);
        subscription.setCancelAtPeriodEnd(true);
        val items = List.copyOf(subscription.getItems());
        when(subscriptionRepository.findByStripeSubscriptionIdForUpdate(STRIPE_SUBSCRIPTION_ID))
            .thenReturn(Optional.of(subscription));

        stateMachine.onSubscriptionDeleted(STRIPE_SUBSCRIPTION_ID);

        assertEquals(SubscriptionStatus.CANCELED, subscription.getStatus());
        assertFalse(subscription.isCancelAtPeriodEnd());
        assertNotNull(subscription.getCanceledAt());
        assertEquals(items, subscription.getItems());
        verify(cache, times(1)).evictIfPresent("isSubscribed:" + ORG_ID);

        // redelivery doesn't change the canceled record again.
        stateMachine.onSubscriptionDeleted(STRIPE_SUBSCRIPTION_ID);
        verify(subscriptionRepository, times(1)).save(subscription);
    }

    @ParameterizedTest(name = "{index} {0}, paid: {1}, stripe: {2} -> {3}")
    @MethodSource("onInvoicePaymentTestCases")
    void onInvoicePayment(
        SubscriptionStatus currentStatus,
        boolean isPaid,
        String stripeStatus,
        SubscriptionStatus expectedStatus
    ) throws Exception {
        val subscription = buildSubscription(currentStatus, STRIPE_SUBSCRIPTION_ID);
        when(subscriptionRepository.findByStripeSubscriptionIdForUpdate(STRIPE_SUBSCRIPTION_ID))
            .thenReturn(Optional.of(subscription));

        if (stripeStatus != null) {
            when(stripeApi.getSubscription(STRIPE_SUBSCRIPTION_ID))
                .thenReturn(buildStripeSubscription(stripeStatus, Map.of("price_basic", 1L)));
        }

        val invoice = buildInvoice();
        if (isPaid) {
            stateMachine.onInvoicePaymentSucceeded(invoice);
        } else {
            stateMachine.onInvoicePaymentFailed(invoice);
        }

        assertEquals(expectedStatus, subscription.getStatus());
        verify(subscriptionRepository, times(currentStatus == expectedStatus ? 0 : 1)).save(subscription);
        verify(cache, times(currentStatus == expectedStatus ? 0 : 1)).evictIfPresent("isSubscribed:" + ORG_ID);
        verify(stripeApi, times(stripeStatus == null ? 0 : 1)).getSubscription(STRIPE_SUBSCRIPTION_ID);
        assertEquals(isPaid ? "payment_succeeded" : "payment_failed", captureLog().getAction());
    }

    static Stream<Arguments> onInvoicePaymentTestCases() {
        return Stream.of(
            // current status, is paid, stripe status (null if not fetched), expected status
            arguments(SubscriptionStatus.PAST_DUE, true, "active", SubscriptionStatus.ACTIVE),
            arguments(SubscriptionStatus.PAST_DUE, true, "past_due", SubscriptionStatus.PAST_DUE),
            arguments(SubscriptionStatus.PAST_DUE, true, "canceled", SubscriptionStatus.PAST_DUE),
            arguments(SubscriptionStatus.ACTIVE, true, null, SubscriptionStatus.ACTIVE),
            arguments(SubscriptionStatus.TRIALING, true, null, SubscriptionStatus.TRIALING),
            arguments(SubscriptionStatus.ACTIVE, false, "past_due", SubscriptionStatus.PAST_DUE),
            // a late failure notice after the retried payment went through.
            arguments(SubscriptionStatus.ACTIVE, false, "active", SubscriptionStatus.ACTIVE),
            arguments(SubscriptionStatus.ACTIVE, false, "unpaid", SubscriptionStatus.ACTIVE),
            arguments(SubscriptionStatus.PAST_DUE, false, null, SubscriptionStatus.PAST_DUE),
            arguments(SubscriptionStatus.TRIALING, false, null, SubscriptionStatus.TRIALING),
            arguments(SubscriptionStatus.CANCELED, false, null, SubscriptionStatus.CANCELED)
        );
    }

    @Test
    void onInvoicePayment_withStripeApiError() throws Exception {
        val subscription = buildSubscription(SubscriptionStatus.ACTIVE, STRIPE_SUBSCRIPTION_ID);
        when(subscriptionRepository.findByStripeSubscriptionIdForUpdate(STRIPE_SUBSCRIPTION_ID))
            .thenReturn(Optional.of(subscription));

        when(stripeApi.getSubscription(STRIPE_SUBSCRIPTION_ID))
            .thenThrow(new ApiConnectionException("test-error"));

        assertThrows(WebhookEventException.class, () -> stateMachine.onInvoicePaymentFailed(buildInvoice()));
        assertEquals(SubscriptionStatus.ACTIVE, subscription.getStatus());
        verify(subscriptionRepository, never()).save(any());
        verify(subscriptionLogRepository, never()).save(any());
    }

    @Test
    void onSubscriptionDeleted_evictsCacheAfterCommit() {
        val subscription = buildSubscription(SubscriptionStatus.ACTIVE, STRIPE_SUBSCRIPTION_ID);
        when(subscriptionRepository.findByStripeSubscriptionIdForUpdate(STRIPE_SUBSCRIPTION_ID))
            .thenReturn(Optional.of(subscription));

        TransactionSynchronizationManager.initSynchronization();
        try {
            stateMachine.onSubscriptionDeleted(STRIPE_SUBSCRIPTION_ID);
            verify(cache, never()).evictIfPresent(any());

            TransactionSynchronizationManager.getSynchronizations().forEach(TransactionSynchronization::afterCommit);
            verify(cache, times(1)).evictIfPresent("isSubscribed:" + ORG_ID);
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    void onInvoicePayment_withoutSubscription() throws Exception {
        val invoice = new Invoice();
        invoice.setId("in_1");
        stateMachine.onInvoicePaymentFailed(invoice);
        verify(subscriptionRepository, never()).findByStripeSubscriptionIdForUpdate(any());
        verify(subscriptionLogRepository, never()).save(any());
    }

    @Test
    void parseModuleKeys() throws WebhookPayloadException {
        assertEquals(List.of(), SubscriptionStateMachine.parseModuleKeys(null));
        assertEquals(List.of("sms", "sms"), SubscriptionStateMachine.parseModuleKeys("[\"sms\",\"sms\"]"));
        assertEquals("[\"sms\",\"email\"]", SubscriptionStateMachine.formatModuleKeys(List.of("sms", "email")));
        assertThrows(WebhookPayloadException.class, () -> SubscriptionStateMachine.parseModuleKeys("[\"\"]"));
        assertThrows(WebhookPayloadException.class, () -> SubscriptionStateMachine.parseModuleKeys("sms"));
    }

    @NonNull
    private SubscriptionLog captureLog() {
        val captor = ArgumentCaptor.forClass(SubscriptionLog.class);
        verify(subscriptionLogRepository, times(1)).save(captor.capture());
        return captor.getValue();
    }

    @NonNull
    private static Invoice buildInvoice() {
        val invoice = new Invoice();
        invoice.setId("in_1");
        invoice.setSubscription(STRIPE_SUBSCRIPTION_ID);
        return invoice;
    }

    @NonNull
    private static Session buildSession(String moduleKeys) {
        val metadata = new HashMap<String, String>();
        metadata.put(SubscriptionStateMachine.METADATA_ORG_ID, ORG_ID);
        metadata.put(SubscriptionStateMachine.METADATA_USER_ID, USER_ID);
        metadata.put(SubscriptionStateMachine.METADATA_PLAN_KEY, "basic");
        if (moduleKeys != null) {
            metadata.put(SubscriptionStateMachine.METADATA_MODULE_KEYS, moduleKeys);
        }

        val session = new Session();
        session.setId("cs_1");
        session.setMode("subscription");
        session.setStatus("complete");
        session.setSubscription(STRIPE_SUBSCRIPTION_ID);
        session.setCustomer("cus_1");
        session.setMetadata(metadata);
        return session;
    }

    @NonNull
    private static com.stripe.model.Subscription buildStripeSubscription(
        @NonNull String status,
        @NonNull Map<String, Long> quantitiesByPriceId
    ) {
        val items = new ArrayList<com.stripe.model.SubscriptionItem>();
        quantitiesByPriceId.entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .forEach(entry -> {
                final Price price = new Price();
                price.setId(entry.getKey());
                final com.stripe.model.SubscriptionItem item = new com.stripe.model.SubscriptionItem();
                item.setPrice(price);
                item.setQuantity(entry.getValue());
                items.add(item);
            });

        val collection = new SubscriptionItemCollection();
        collection.setData(items);

        val subscription = new com.stripe.model.Subscription();
        subscription.setId(STRIPE_SUBSCRIPTION_ID);
        subscription.setStatus(status);
        subscription.setCustomer("cus_1");
        subscription.setItems(collection);
        subscription.setCancelAtPeriodEnd(false);
        subscription.setBillingCycleAnchor(1_700_000_000L);
        subscription.setCurrentPeriodEnd(1_702_592_000L);
        return subscription;
    }

    @NonNull
    private static Subscription buildSubscription(@NonNull SubscriptionStatus status, @NonNull String stripeSubscriptionId) {
        return Subscription.builder()
            .id(1)
            .orgId(ORG_ID)
            .status(status)
            .payerId(USER_ID)
            .stripeSubscriptionId(stripeSubscriptionId)
            .stripeCustomerId("cus_1")
            .items(new ArrayList<>(List.of(SubscriptionItem.plan("basic", "Basic", "price_basic"))))
            .build();
    }
}

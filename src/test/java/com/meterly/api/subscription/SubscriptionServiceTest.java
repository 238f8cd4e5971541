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
import com.meterly.api.subscription.exceptions.DuplicateSubscriptionException;
import com.meterly.api.subscription.exceptions.StripeCustomerPortalUrlException;
import com.meterly.api.subscription.exceptions.SubscriptionModuleNotFoundException;
import com.meterly.api.subscription.exceptions.SubscriptionNotFoundException;
import com.meterly.api.subscription.exceptions.SubscriptionPlanNotFoundException;
import com.meterly.api.subscription.payload.CheckoutSessionParams;
import com.meterly.api.subscription.upstream.StripeApi;
import com.stripe.exception.ApiConnectionException;
import com.stripe.exception.StripeException;
import com.stripe.model.Customer;
import com.stripe.model.checkout.Session;
import jakarta.validation.ConstraintViolationException;
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

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.params.provider.Arguments.arguments;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class SubscriptionServiceTest {

    private static final String ORG_ID = "org-1";
    private static final String USER_ID = "user-1";

    private static final CatalogSnapshot CATALOG = CatalogSnapshot.of(
        List.of(
            buildPlan("basic", "price_basic", CatalogSnapshot.Status.ACTIVE, 14),
            buildPlan("legacy", "price_legacy", CatalogSnapshot.Status.DEPRECATED, 0)),
        List.of(
            buildModule("sms", "price_sms", CatalogSnapshot.Status.ACTIVE, true),
            buildModule("sso", "price_sso", CatalogSnapshot.Status.ACTIVE, false),
            buildModule("fax", "price_fax", CatalogSnapshot.Status.INACTIVE, false)),
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

    private SubscriptionService service;

    @BeforeEach
    void setUp() throws StripeException {
        service = new SubscriptionService(
            new SubscriptionConfiguration(
                "sk_test", "whsec_test", "https://app.meterly.io/success", "https://app.meterly.io/cancel",
                Duration.ofHours(1), Duration.ofMinutes(1)),
            subscriptionRepository,
            trialStatusRepository,
            subscriptionLogRepository,
            catalogServiceContract,
            stripeApi);

        lenient().when(catalogServiceContract.getPlanByKey(anyString()))
            .thenAnswer(invocation -> CATALOG.findPlan(invocation.getArgument(0)));

        lenient().when(catalogServiceContract.getModulesByKeys(any()))
            .thenAnswer(invocation -> {
                final Collection<String> keys = invocation.getArgument(0);
                return keys.stream()
                    .map(CATALOG::findModule)
                    .flatMap(Optional::stream)
                    .collect(Collectors.toList());
            });

        val customer = new Customer();
        customer.setId("cus_new");
        lenient().when(stripeApi.createCustomer(anyMap())).thenReturn(customer);

        val session = new Session();
        session.setId("cs_1");
        session.setUrl("https://checkout.stripe.com/cs_1");
        lenient().when(stripeApi.createCheckoutSession(any(), any(), any(), any(), any(), any(), any(), any()))
            .thenReturn(session);
    }

    @Test
    void createCheckoutSession_withNewOrg() throws Exception {
        when(subscriptionRepository.findByOrgId(ORG_ID)).thenReturn(Optional.empty());
        when(trialStatusRepository.findById(USER_ID)).thenReturn(Optional.empty());

        val response = service.createCheckoutSession(USER_ID, buildParams("basic", "sms", "sms", "sso"));
        assertEquals("cs_1", response.getSessionId());
        assertEquals("https://checkout.stripe.com/cs_1", response.getUrl());
        assertTrue(response.getIsTrialOffered());

        @SuppressWarnings("unchecked")
        final ArgumentCaptor<Map<String, Long>> quantitiesCaptor = ArgumentCaptor.forClass(Map.class);
        @SuppressWarnings("unchecked")
        final ArgumentCaptor<Map<String, String>> metadataCaptor = ArgumentCaptor.forClass(Map.class);
        verify(stripeApi, times(1)).createCheckoutSession(
            eq("https://app.meterly.io/success"),
            eq("https://app.meterly.io/cancel"),
            quantitiesCaptor.capture(),
            eq(Duration.ofHours(1)),
            eq("cus_new"),
            metadataCaptor.capture(),
            any(),
            eq(14L));

        assertEquals(Map.of("price_basic", 1L, "price_sms", 2L, "price_sso", 1L), quantitiesCaptor.getValue());
        assertEquals(ORG_ID, metadataCaptor.getValue().get(SubscriptionStateMachine.METADATA_ORG_ID));
        assertEquals(USER_ID, metadataCaptor.getValue().get(SubscriptionStateMachine.METADATA_USER_ID));
        assertEquals("basic", metadataCaptor.getValue().get(SubscriptionStateMachine.METADATA_PLAN_KEY));
        assertEquals("[\"sms\",\"sms\",\"sso\"]", metadataCaptor.getValue().get(SubscriptionStateMachine.METADATA_MODULE_KEYS));

        val logCaptor = ArgumentCaptor.forClass(SubscriptionLog.class);
        verify(subscriptionLogRepository, times(1)).save(logCaptor.capture());
        assertEquals("checkout_session_created", logCaptor.getValue().getAction());
    }

    @Test
    void createCheckoutSession_withUsedTrialAndCanceledSubscription() throws Exception {
        val canceled = buildSubscription(SubscriptionStatus.CANCELED);
        when(subscriptionRepository.findByOrgId(ORG_ID)).thenReturn(Optional.of(canceled));
        when(trialStatusRepository.findById(USER_ID))
            .thenReturn(Optional.of(TrialStatus.builder().payerId(USER_ID).hasUsedTrial(true).build()));

        val response = service.createCheckoutSession(USER_ID, buildParams("basic"));
        assertFalse(response.getIsTrialOffered());

        verify(stripeApi, never()).createCustomer(anyMap());
        verify(stripeApi, times(1))
            .createCheckoutSession(any(), any(), any(), any(), eq("cus_1"), any(), any(), isNull());
    }

    @ParameterizedTest(name = "{index} {0}")
    @MethodSource("createCheckoutSession_withInvalidParamsTestCases")
    void createCheckoutSession_withInvalidParams(
        String name,
        CheckoutSessionParams params,
        Class<? extends Throwable> expectedException
    ) throws StripeException {
        lenient().when(subscriptionRepository.findByOrgId(ORG_ID)).thenReturn(Optional.empty());
        assertThrows(expectedException, () -> service.createCheckoutSession(USER_ID, params));
        verify(stripeApi, never()).createCheckoutSession(any(), any(), any(), any(), any(), any(), any(), any());
    }

    static Stream<Arguments> createCheckoutSession_withInvalidParamsTestCases() {
        return Stream.of(
            arguments("unknown plan", buildParams("unknown"), SubscriptionPlanNotFoundException.class),
            arguments("deprecated plan", buildParams("legacy"), SubscriptionPlanNotFoundException.class),
            arguments("unknown module", buildParams("basic", "unknown"), SubscriptionModuleNotFoundException.class),
            arguments("inactive module", buildParams("basic", "fax"), SubscriptionModuleNotFoundException.class),
            arguments("repeated single module", buildParams("basic", "sso", "sso"), ConstraintViolationException.class)
        );
    }

    @ParameterizedTest(name = "{index} {0}")
    @MethodSource("createCheckoutSession_withExistingSubscriptionTestCases")
    void createCheckoutSession_withExistingSubscription(SubscriptionStatus status) throws StripeException {
        when(subscriptionRepository.findByOrgId(ORG_ID)).thenReturn(Optional.of(buildSubscription(status)));
        assertThrows(DuplicateSubscriptionException.class, () -> service.createCheckoutSession(USER_ID, buildParams("basic")));
        verify(stripeApi, never()).createCheckoutSession(any(), any(), any(), any(), any(), any(), any(), any());
    }

    static Stream<SubscriptionStatus> createCheckoutSession_withExistingSubscriptionTestCases() {
        return Stream.of(SubscriptionStatus.TRIALING, SubscriptionStatus.ACTIVE, SubscriptionStatus.PAST_DUE);
    }

    @Test
    void createCheckoutSession_withStripeApiError() throws Exception {
        when(subscriptionRepository.findByOrgId(ORG_ID)).thenReturn(Optional.empty());
        when(stripeApi.createCheckoutSession(any(), any(), any(), any(), any(), any(), any(), any()))
            .thenThrow(new ApiConnectionException("test-error"));

        assertThrows(RuntimeException.class, () -> service.createCheckoutSession(USER_ID, buildParams("basic")));
        verify(subscriptionLogRepository, never()).save(any());
    }

    @Test
    void getSubscription() throws SubscriptionNotFoundException {
        when(subscriptionRepository.findByOrgId(ORG_ID)).thenReturn(Optional.of(buildSubscription(SubscriptionStatus.PAST_DUE)));
        when(subscriptionRepository.findByOrgId("org-2")).thenReturn(Optional.empty());

        val response = service.getSubscription(ORG_ID);
        assertEquals("past_due", response.getStatus());
        assertEquals("basic", response.getPlanKey());
        assertFalse(response.getCancelAtPeriodEnd());
        assertThrows(SubscriptionNotFoundException.class, () -> service.getSubscription("org-2"));
    }

    @Test
    void cancelSubscription() throws Exception {
        val subscription = buildSubscription(SubscriptionStatus.ACTIVE);
        when(subscriptionRepository.findByOrgIdForUpdate(ORG_ID)).thenReturn(Optional.of(subscription));

        service.cancelSubscription(USER_ID, ORG_ID);

        verify(stripeApi, times(1)).cancelSubscription("sub_1");
        verify(subscriptionRepository, times(1)).save(subscription);
        assertTrue(subscription.isCancelAtPeriodEnd());
        assertEquals(SubscriptionStatus.ACTIVE, subscription.getStatus());
    }

    @Test
    void cancelSubscription_withCanceledSubscription() throws StripeException {
        when(subscriptionRepository.findByOrgIdForUpdate(ORG_ID))
            .thenReturn(Optional.of(buildSubscription(SubscriptionStatus.CANCELED)));

        assertThrows(SubscriptionNotFoundException.class, () -> service.cancelSubscription(USER_ID, ORG_ID));
        verify(stripeApi, never()).cancelSubscription(any());
    }

    @Test
    void createBillingPortalSession() throws Exception {
        val portalSession = new com.stripe.model.billingportal.Session();
        portalSession.setUrl("https://billing.stripe.com/p_1");
        when(subscriptionRepository.findByOrgId(ORG_ID)).thenReturn(Optional.of(buildSubscription(SubscriptionStatus.ACTIVE)));
        when(subscriptionRepository.findByOrgId("org-2")).thenReturn(Optional.empty());
        when(stripeApi.createCustomerPortalSession("cus_1", "https://app.meterly.io/billing"))
            .thenReturn(portalSession);

        val response = service.createBillingPortalSession(USER_ID, ORG_ID, "https://app.meterly.io/billing");
        assertEquals("https://billing.stripe.com/p_1", response.getUrl());
        assertThrows(StripeCustomerPortalUrlException.class,
            () -> service.createBillingPortalSession(USER_ID, "org-2", "https://app.meterly.io/billing"));
    }

    @Test
    void findOrgSubscription() {
        when(subscriptionRepository.findByOrgId(ORG_ID)).thenReturn(Optional.of(buildSubscription(SubscriptionStatus.TRIALING)));

        val subscription = service.findOrgSubscription(ORG_ID).orElseThrow();
        assertEquals("trialing", subscription.getStatus());
        assertEquals(1, subscription.getItems().size());

        when(subscriptionRepository.findByOrgId("org-2")).thenReturn(Optional.empty());
        assertTrue(service.findOrgSubscription("org-2").isEmpty());
    }

    @Test
    void isOrgSubscribed() {
        when(subscriptionRepository.existsEntitlingByOrgId(ORG_ID)).thenReturn(true);
        when(subscriptionRepository.existsEntitlingByOrgId("org-2")).thenReturn(false);
        assertTrue(service.isOrgSubscribed(ORG_ID));
        assertFalse(service.isOrgSubscribed("org-2"));
    }

    @NonNull
    private static CheckoutSessionParams buildParams(@NonNull String planKey, @NonNull String... moduleKeys) {
        return new CheckoutSessionParams(ORG_ID, planKey, List.of(moduleKeys), null, null);
    }

    @NonNull
    private static Subscription buildSubscription(@NonNull SubscriptionStatus status) {
        return Subscription.builder()
            .id(1)
            .orgId(ORG_ID)
            .status(status)
            .payerId(USER_ID)
            .stripeSubscriptionId("sub_1")
            .stripeCustomerId("cus_1")
            .items(List.of(SubscriptionItem.plan("basic", "Basic", "price_basic")))
            .build();
    }

    @NonNull
    private static CatalogSnapshot.Plan buildPlan(
        @NonNull String key,
        @NonNull String priceId,
        @NonNull CatalogSnapshot.Status status,
        int trialDurationDays
    ) {
        return CatalogSnapshot.Plan.builder()
            .key(key)
            .name(key)
            .stripePriceId(priceId)
            .status(status)
            .trialDurationDays(trialDurationDays)
            .build();
    }

    @NonNull
    private static CatalogSnapshot.Module buildModule(
        @NonNull String key,
        @NonNull String priceId,
        @NonNull CatalogSnapshot.Status status,
        boolean allowMultiple
    ) {
        return CatalogSnapshot.Module.builder()
            .key(key)
            .name(key)
            .stripePriceId(priceId)
            .status(status)
            .allowMultiple(allowMultiple)
            .build();
    }
}

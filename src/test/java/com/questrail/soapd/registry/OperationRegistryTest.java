package com.questrail.soapd.registry;

import com.questrail.soapd.api.HandlerResult;
import com.questrail.soapd.api.OperationHandler;
import com.questrail.soapd.api.ProtocolVersion;
import com.questrail.soapd.api.SoapConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.questrail.soapd.api.ProtocolVersion.SOAP11;
import static com.questrail.soapd.api.ProtocolVersion.SOAP12;
import static org.junit.jupiter.api.Assertions.*;

class OperationRegistryTest {

    private OperationRegistry registry;

    private static final OperationHandler DECLINE = (name, env, info) -> HandlerResult.noMatch();

    @BeforeEach
    void setUp() {
        registry = new OperationRegistry();
    }

    private static OperationHandler handler() {
        return (name, env, info) -> HandlerResult.noMatch();
    }

    // ---------------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------------

    @Test
    void lookupReturnsTheRegisteredHandler() {
        OperationHandler a = handler();
        OperationHandler b = handler();
        registry.register(SOAP11, "getInfo", a);
        registry.register(SOAP12, "getInfo", b);

        assertSame(a, registry.lookupByName(SOAP11, "getInfo").orElseThrow());
        assertSame(b, registry.lookupByName(SOAP12, "getInfo").orElseThrow());
        assertTrue(registry.lookupByName(SOAP11, "other").isEmpty());
    }

    @Test
    void registeringTwiceKeepsTheLastHandler() {
        OperationHandler first = handler();
        OperationHandler second = handler();
        registry.register(SOAP11, "getInfo", first);
        registry.register(SOAP11, "getInfo", second);

        assertSame(second, registry.lookupByName(SOAP11, "getInfo").orElseThrow());
        assertEquals(Set.of("getInfo"), registry.allNames(SOAP11));
    }

    @Test
    void missingHandlerIsAConfigurationError() {
        assertThrows(SoapConfigurationException.class, () -> registry.register(SOAP11, "getInfo", null));
        assertThrows(SoapConfigurationException.class, () -> registry.register(SOAP11, " ", DECLINE));
        assertThrows(SoapConfigurationException.class, () -> registry.register(null, "getInfo", DECLINE));
        assertTrue(registry.isEmpty());
    }

    @Test
    void namesAndHandlersKeepRegistrationOrder() {
        registry.register(SOAP11, "c", DECLINE);
        registry.register(SOAP11, "a", DECLINE);
        registry.register(SOAP11, "b", DECLINE);

        assertEquals(List.of("c", "a", "b"), List.copyOf(registry.allNames(SOAP11)));
        assertEquals(List.of("c", "a", "b"),
                registry.handlers(SOAP11).stream().map(OperationRegistry.Registration::name).toList());
    }

    @Test
    void handlerSnapshotIsNotAffectedByLaterRegistrations() {
        registry.register(SOAP11, "a", DECLINE);
        List<OperationRegistry.Registration> before = registry.handlers(SOAP11);

        registry.register(SOAP11, "b", DECLINE);

        assertEquals(1, before.size());
        assertEquals(2, registry.handlers(SOAP11).size());
    }

    @Test
    void versionsListsOnlyVersionsWithOperations() {
        assertEquals(Set.of(), registry.versions());

        registry.register(SOAP12, "a", DECLINE);
        assertEquals(Set.of(SOAP12), registry.versions());

        registry.register(SOAP11, "a", DECLINE);
        assertEquals(List.of(SOAP11, SOAP12), List.copyOf(registry.versions()));
    }

    // ---------------------------------------------------------------------
    // Action tables
    // ---------------------------------------------------------------------

    @Test
    void wsaInputMappingFirstWinsInBothDirections() {
        registry.addActionMapping(ActionDirection.INPUT, Map.of("a", "urn:a"));
        registry.addActionMapping(ActionDirection.INPUT, Map.of("a", "urn:other"));

        Map<String, String> claim = new LinkedHashMap<>();
        claim.put("b", "urn:a");
        registry.addActionMapping(ActionDirection.INPUT, claim);

        assertEquals(Optional.of("urn:a"), registry.wsaAction(ActionDirection.INPUT, "a"));
        assertEquals(Optional.of("a"), registry.lookupByWsaAction("urn:a"));
        // reverse entries are merged independently of the forward ones
        assertEquals(Optional.of("a"), registry.lookupByWsaAction("urn:other"));
        // the forward entry of b is still recorded
        assertEquals(Optional.of("urn:a"), registry.wsaAction(ActionDirection.INPUT, "b"));
    }

    @Test
    void wsaOutputMappingHasNoReverseLookup() {
        registry.addActionMapping(ActionDirection.OUTPUT, Map.of("a", "urn:a-response"));

        assertEquals(Optional.of("urn:a-response"), registry.wsaAction(ActionDirection.OUTPUT, "a"));
        assertTrue(registry.lookupByWsaAction("urn:a-response").isEmpty());
        assertTrue(registry.wsaAction(ActionDirection.INPUT, "a").isEmpty());
    }

    @Test
    void soapActionMappingFirstWins() {
        registry.addSoapActionMapping(Map.of("a", "act"));
        registry.addSoapActionMapping(Map.of("b", "act"));

        assertEquals(Optional.of("a"), registry.lookupBySoapAction("act"));
        assertEquals(Optional.of("act"), registry.soapAction("a"));
    }

    @Test
    void blankActionsAreIgnored() {
        Map<String, String> actions = new LinkedHashMap<>();
        actions.put("a", "");
        actions.put("b", null);
        registry.addSoapActionMapping(actions);

        assertTrue(registry.soapAction("a").isEmpty());
        assertTrue(registry.soapAction("b").isEmpty());
        assertTrue(registry.lookupBySoapAction("").isEmpty());
        assertTrue(registry.lookupBySoapAction(null).isEmpty());
    }

    @Test
    void missingDirectionIsAConfigurationError() {
        assertThrows(SoapConfigurationException.class,
                () -> registry.addActionMapping(null, Map.of("a", "urn:a")));
    }

    // ---------------------------------------------------------------------
    // Index
    // ---------------------------------------------------------------------

    @Test
    void indexListsSortedNamesPerVersion() {
        registry.register(SOAP11, "getNames", DECLINE);
        registry.register(SOAP11, "getInfo", DECLINE);
        registry.register(SOAP12, "getInfo", DECLINE);

        assertEquals("SOAP11:\n   getInfo\n   getNames\nSOAP12:\n   getInfo\n", registry.index());
    }

    @Test
    void emptyRegistryHasEmptyIndex() {
        assertEquals("", registry.index());
        assertTrue(registry.allNames(ProtocolVersion.SOAP11).isEmpty());
    }
}

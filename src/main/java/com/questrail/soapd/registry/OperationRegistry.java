package com.questrail.soapd.registry;

import com.questrail.soapd.api.OperationHandler;
import com.questrail.soapd.api.ProtocolVersion;
import com.questrail.soapd.api.SoapConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * OperationRegistry
 * -----------------------------------------------------------------------------
 * Process-wide table of operation handlers and the action tables used to
 * route messages to them.
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li>per protocol version: operation name → {@link OperationHandler}</li>
 *   <li>WS-Addressing input and output actions, per operation name</li>
 *   <li>SOAPAction values, per operation name</li>
 *   <li>reverse tables (action → operation name) for WSA input and SOAPAction</li>
 * </ul>
 *
 * <h2>Merge rules</h2>
 * {@link #register} overwrites: registering the same (version, name) twice
 * keeps the last handler. The action tables do the opposite: a mapping that
 * is already present, in either direction, is never replaced, so the first
 * registration of an operation's action (and of an action's operation) wins.
 *
 * <h2>Concurrency</h2>
 * All registration is expected to happen at startup, before the first
 * request is dispatched. Writers are serialized and publish an immutable
 * {@link Snapshot}; readers never lock. Registering while traffic is flowing
 * is not supported: a request may observe the registry before or after a
 * concurrent write, never half of one.
 */
public final class OperationRegistry
{
    private static final Logger log = LoggerFactory.getLogger(OperationRegistry.class);

    /**
     * One registered operation, as seen by the exhaustive strategy.
     */
    public record Registration(String name, OperationHandler handler) {}

    private record Snapshot(
            Map<ProtocolVersion, Map<String, OperationHandler>> handlers,
            Map<String, String> wsaInput,
            Map<String, String> wsaInputReverse,
            Map<String, String> wsaOutput,
            Map<String, String> soapAction,
            Map<String, String> soapActionReverse
    ) {
        static Snapshot empty() {
            return new Snapshot(Map.of(), Map.of(), Map.of(), Map.of(), Map.of(), Map.of());
        }
    }

    private final Object writeLock = new Object();
    private volatile Snapshot snapshot = Snapshot.empty();

    // ---------------------------------------------------------------------
    // Registration
    // ---------------------------------------------------------------------

    /**
     * Registers a handler under (version, name), replacing any previous one.
     *
     * @throws SoapConfigurationException if any argument is missing
     */
    public void register(ProtocolVersion version, String name, OperationHandler handler) {
        if (version == null) {
            throw new SoapConfigurationException("protocol version required for operation '" + name + "'");
        }
        if (name == null || name.isBlank()) {
            throw new SoapConfigurationException("operation name required");
        }
        if (handler == null) {
            throw new SoapConfigurationException("handler for " + version + " operation '" + name + "' is not callable");
        }

        synchronized (writeLock) {
            Snapshot s = snapshot;
            Map<ProtocolVersion, Map<String, OperationHandler>> handlers = new EnumMap<>(ProtocolVersion.class);
            handlers.putAll(s.handlers());

            Map<String, OperationHandler> perVersion = new LinkedHashMap<>(handlers.getOrDefault(version, Map.of()));
            OperationHandler previous = perVersion.put(name, handler);
            handlers.put(version, Collections.unmodifiableMap(perVersion));

            snapshot = new Snapshot(Collections.unmodifiableMap(handlers),
                    s.wsaInput(), s.wsaInputReverse(), s.wsaOutput(),
                    s.soapAction(), s.soapActionReverse());

            if (previous != null) {
                log.debug("replaced handler for {} operation '{}'", version, name);
            } else {
                log.debug("added handler for {} operation '{}'", version, name);
            }
        }
    }

    /**
     * Merges operation name → WS-Addressing action pairs into the input or
     * output table. Existing entries are kept; blank actions are ignored.
     */
    public void addActionMapping(ActionDirection direction, Map<String, String> actionsByName) {
        if (direction == null) {
            throw new SoapConfigurationException("action direction must be INPUT or OUTPUT");
        }
        if (actionsByName == null || actionsByName.isEmpty()) {
            return;
        }

        synchronized (writeLock) {
            Snapshot s = snapshot;
            if (direction == ActionDirection.INPUT) {
                Map<String, String> forward = new HashMap<>(s.wsaInput());
                Map<String, String> reverse = new HashMap<>(s.wsaInputReverse());
                merge(actionsByName, forward, reverse);
                snapshot = new Snapshot(s.handlers(), Map.copyOf(forward), Map.copyOf(reverse),
                        s.wsaOutput(), s.soapAction(), s.soapActionReverse());
            } else {
                Map<String, String> forward = new HashMap<>(s.wsaOutput());
                merge(actionsByName, forward, null);
                snapshot = new Snapshot(s.handlers(), s.wsaInput(), s.wsaInputReverse(),
                        Map.copyOf(forward), s.soapAction(), s.soapActionReverse());
            }
        }
    }

    /**
     * Merges operation name → SOAPAction pairs. Values are stored as given,
     * without surrounding quotes.
     */
    public void addSoapActionMapping(Map<String, String> actionsByName) {
        if (actionsByName == null || actionsByName.isEmpty()) {
            return;
        }

        synchronized (writeLock) {
            Snapshot s = snapshot;
            Map<String, String> forward = new HashMap<>(s.soapAction());
            Map<String, String> reverse = new HashMap<>(s.soapActionReverse());
            merge(actionsByName, forward, reverse);
            snapshot = new Snapshot(s.handlers(), s.wsaInput(), s.wsaInputReverse(), s.wsaOutput(),
                    Map.copyOf(forward), Map.copyOf(reverse));
        }
    }

    private static void merge(Map<String, String> actionsByName,
                              Map<String, String> forward,
                              Map<String, String> reverse) {
        for (Map.Entry<String, String> e : actionsByName.entrySet()) {
            String name = e.getKey();
            String action = e.getValue();
            if (name == null || action == null || action.isBlank()) {
                continue;
            }
            forward.putIfAbsent(name, action);
            if (reverse != null) {
                String owner = reverse.putIfAbsent(action, name);
                if (owner != null && !owner.equals(name)) {
                    log.debug("action '{}' already routes to '{}', ignored for '{}'", action, owner, name);
                }
            }
        }
    }

    // ---------------------------------------------------------------------
    // Lookups
    // ---------------------------------------------------------------------

    public Optional<OperationHandler> lookupByName(ProtocolVersion version, String name) {
        Map<String, OperationHandler> perVersion = snapshot.handlers().get(version);
        return perVersion == null ? Optional.empty() : Optional.ofNullable(perVersion.get(name));
    }

    public Optional<String> lookupByWsaAction(String action) {
        return action == null ? Optional.empty() : Optional.ofNullable(snapshot.wsaInputReverse().get(action));
    }

    public Optional<String> lookupBySoapAction(String action) {
        return action == null ? Optional.empty() : Optional.ofNullable(snapshot.soapActionReverse().get(action));
    }

    public Optional<String> wsaAction(ActionDirection direction, String name) {
        Snapshot s = snapshot;
        Map<String, String> table = direction == ActionDirection.INPUT ? s.wsaInput() : s.wsaOutput();
        return Optional.ofNullable(table.get(name));
    }

    public Optional<String> soapAction(String name) {
        return Optional.ofNullable(snapshot.soapAction().get(name));
    }

    /**
     * Names registered for a version, in registration order.
     */
    public Set<String> allNames(ProtocolVersion version) {
        Map<String, OperationHandler> perVersion = snapshot.handlers().get(version);
        return perVersion == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(perVersion.keySet()));
    }

    /**
     * Handlers registered for a version, in registration order.
     */
    public List<Registration> handlers(ProtocolVersion version) {
        Map<String, OperationHandler> perVersion = snapshot.handlers().get(version);
        if (perVersion == null) {
            return List.of();
        }
        List<Registration> out = new ArrayList<>(perVersion.size());
        perVersion.forEach((name, handler) -> out.add(new Registration(name, handler)));
        return Collections.unmodifiableList(out);
    }

    /**
     * Versions with at least one registered operation, in declaration order.
     */
    public Set<ProtocolVersion> versions() {
        Set<ProtocolVersion> out = new TreeSet<>();
        snapshot.handlers().forEach((version, perVersion) -> {
            if (!perVersion.isEmpty()) {
                out.add(version);
            }
        });
        return Collections.unmodifiableSet(out);
    }

    public boolean isEmpty() {
        return versions().isEmpty();
    }

    // ---------------------------------------------------------------------
    // Diagnostics
    // ---------------------------------------------------------------------

    /**
     * Table of the operations the daemon can handle, per version:
     * <pre>
     * SOAP11:
     *    getInfo
     *    getNames
     * </pre>
     */
    public String index() {
        StringBuilder sb = new StringBuilder();
        for (ProtocolVersion version : versions()) {
            sb.append(version).append(":\n");
            for (String name : new TreeSet<>(allNames(version))) {
                sb.append("   ").append(name).append('\n');
            }
        }
        return sb.toString();
    }

    public void printIndex(PrintStream out) {
        Objects.requireNonNull(out, "out").print(index());
    }
}

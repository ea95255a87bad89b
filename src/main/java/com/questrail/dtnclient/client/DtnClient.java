package com.questrail.dtnclient.client;

import com.questrail.dtnclient.config.DtnClientConfig;
import com.questrail.dtnclient.eid.EndpointId;
import com.questrail.dtnclient.protocol.codec.MessageRegistry;
import com.questrail.dtnclient.protocol.codec.impl.DecodeFailureArchive;
import com.questrail.dtnclient.protocol.codec.impl.MsgpackMessageCodec;
import com.questrail.dtnclient.protocol.model.BundleContent;
import com.questrail.dtnclient.protocol.model.BundleCreate;
import com.questrail.dtnclient.protocol.model.BundleCreateResponse;
import com.questrail.dtnclient.protocol.model.FetchAllBundles;
import com.questrail.dtnclient.protocol.model.FetchAllBundlesResponse;
import com.questrail.dtnclient.protocol.model.FetchBundle;
import com.questrail.dtnclient.protocol.model.FetchBundleResponse;
import com.questrail.dtnclient.protocol.model.ListBundles;
import com.questrail.dtnclient.protocol.model.ListResponse;
import com.questrail.dtnclient.protocol.model.RegisterUnregister;
import com.questrail.dtnclient.transport.ConnectionFactory;
import com.questrail.dtnclient.transport.SocketChannelConnectionFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * DtnClient
 * =============================================================================
 * Typed operations against dtnd's application agent.
 *
 * <h2>Architectural Role</h2>
 * This class is a composition root and a thin facade: it wires a
 * {@link ConnectionFactory}, the MessagePack codec and a {@link FramedCall},
 * and maps each operation onto one request variant and the reply variant it
 * expects. It holds no mutable state; independent threads may share an
 * instance, each call using its own connection.
 *
 * <h2>Failures</h2>
 * Every operation may throw
 * {@link com.questrail.dtnclient.transport.DaemonNotFoundException},
 * {@link DataException}, {@link DtndException},
 * {@link com.questrail.dtnclient.protocol.model.InvalidMessageException}
 * or another {@link IOException}; see {@link FramedCall}.
 */
public final class DtnClient
{
    private final ConnectionFactory connectionFactory;
    private final FramedCall framedCall;

    public DtnClient(DtnClientConfig config) {
        this(
                new SocketChannelConnectionFactory(config.daemonAddress(), config.timeout()),
                new FramedCall(
                        new MsgpackMessageCodec(
                                MessageRegistry.defaults(),
                                new DecodeFailureArchive(config.diagnosticsDirectory())),
                        config.observabilitySink())
        );
    }

    public DtnClient(ConnectionFactory connectionFactory, FramedCall framedCall) {
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        this.framedCall = Objects.requireNonNull(framedCall, "framedCall");
    }

    /**
     * Registers {@code endpoint} with dtnd, so bundles addressed to it are kept.
     */
    public void register(EndpointId endpoint) throws IOException {
        registerUnregister(endpoint, true);
    }

    /**
     * Removes the registration of {@code endpoint}.
     */
    public void unregister(EndpointId endpoint) throws IOException {
        registerUnregister(endpoint, false);
    }

    /**
     * Performs a registration ({@code register == true}) or unregistration.
     */
    public void registerUnregister(EndpointId endpoint, boolean register) throws IOException {
        RegisterUnregister request = register
                ? RegisterUnregister.register(endpoint)
                : RegisterUnregister.unregister(endpoint);
        framedCall.call(connectionFactory, request);
    }

    /**
     * Creates a new bundle.
     *
     * @param args bundle builder arguments, see {@link BundleCreate}
     * @return the identifier of the new bundle
     */
    public String createBundle(Map<String, Object> args) throws IOException {
        return framedCall.call(connectionFactory, BundleCreate.of(args), BundleCreateResponse.class)
                .bundleId();
    }

    /**
     * Lists the identifiers of the bundles stored in {@code mailbox}.
     *
     * @param newOnly list only bundles that have never been fetched
     */
    public List<String> listBundles(EndpointId mailbox, boolean newOnly) throws IOException {
        return framedCall.call(connectionFactory, ListBundles.of(mailbox, newOnly), ListResponse.class)
                .bundleIds();
    }

    /**
     * Fetches one bundle by its identifier.
     *
     * @param remove delete the bundle from the mailbox after fetching
     */
    public BundleContent fetchBundle(EndpointId mailbox, String bundleId, boolean remove) throws IOException {
        return framedCall.call(connectionFactory, FetchBundle.of(mailbox, bundleId, remove),
                FetchBundleResponse.class).content();
    }

    /**
     * Fetches every bundle stored in {@code mailbox}.
     *
     * @param newOnly fetch only bundles that have never been fetched
     * @param remove  delete the bundles from the mailbox after fetching
     */
    public List<BundleContent> fetchAllBundles(EndpointId mailbox, boolean newOnly, boolean remove)
            throws IOException
    {
        return framedCall.call(connectionFactory, FetchAllBundles.of(mailbox, newOnly, remove),
                FetchAllBundlesResponse.class).contents();
    }
}

package tap.java.grpc;

import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Grpc;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;

import java.net.InetSocketAddress;
import java.net.SocketAddress;

/**
 * Puts the caller's IP address into the gRPC {@link Context}.
 *
 * The first entry of {@code x-forwarded-for} wins, so the service can sit
 * behind a proxy; otherwise the transport's remote address is used.
 */
public final class RemoteAddressInterceptor implements ServerInterceptor {

    public static final Context.Key<String> SOURCE_IP = Context.key("tap-source-ip");

    static final Metadata.Key<String> FORWARDED_FOR =
        Metadata.Key.of("x-forwarded-for", Metadata.ASCII_STRING_MARSHALLER);

    static final String UNKNOWN = "unknown";

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
        ServerCall<ReqT, RespT> call,
        Metadata headers,
        ServerCallHandler<ReqT, RespT> next
    ) {
        String ip = resolve(headers.get(FORWARDED_FOR), call.getAttributes().get(Grpc.TRANSPORT_ATTR_REMOTE_ADDR));
        return Contexts.interceptCall(Context.current().withValue(SOURCE_IP, ip), call, headers, next);
    }

    static String resolve(String forwardedFor, SocketAddress remote) {
        if (forwardedFor != null) {
            String first = forwardedFor.split(",", 2)[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        if (remote instanceof InetSocketAddress inet && inet.getAddress() != null) {
            return inet.getAddress().getHostAddress();
        }
        return UNKNOWN;
    }

    /**
     * @return the caller's address for the current call, or "unknown"
     */
    public static String currentSourceIp() {
        String ip = SOURCE_IP.get();
        return ip != null ? ip : UNKNOWN;
    }
}

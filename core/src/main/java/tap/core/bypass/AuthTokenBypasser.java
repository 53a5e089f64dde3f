package tap.core.bypass;

import tap.core.model.FundingRequest;

import java.util.Collection;
import java.util.Set;

public final class AuthTokenBypasser implements Bypasser {
    private final Set<String> tokens;

    public AuthTokenBypasser(Collection<String> tokens) {
        if (tokens == null) throw new IllegalArgumentException("tokens cannot be null");
        this.tokens = Set.copyOf(tokens);
    }

    @Override
    public BypassDecision evaluate(FundingRequest request) {
        if (request.hasAuthToken() && tokens.contains(request.authToken())) {
            return BypassDecision.BYPASS;
        }
        return BypassDecision.NO_OPINION;
    }

    @Override
    public BypasserKind kind() {
        return BypasserKind.AUTH_TOKEN;
    }
}

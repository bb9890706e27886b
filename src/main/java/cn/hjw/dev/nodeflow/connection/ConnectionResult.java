package cn.hjw.dev.nodeflow.connection;

import cn.hjw.dev.nodeflow.transform.Transformer;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;
import java.util.Optional;

/**
 * 连接校验结果
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class ConnectionResult {

    @Getter(AccessLevel.NONE)
    private final boolean canConnect;

    // 为空表示值原样传递
    @Getter(AccessLevel.NONE)
    private final Transformer transformer;

    private final CompatibilityPath path;

    private final double cost;

    private final double confidence;

    private final ConnectionErrorCode errorCode;

    @Singular
    private final List<String> errors;

    @Singular
    private final List<String> warnings;

    @Singular
    private final List<String> suggestions;

    public boolean canConnect() {
        return canConnect;
    }

    public Optional<Transformer> transformer() {
        return Optional.ofNullable(transformer);
    }

    public boolean requiresTransformation() {
        return transformer != null;
    }

    static ConnectionResult rejected(ConnectionErrorCode code, String error) {
        return ConnectionResult.builder()
                .canConnect(false)
                .cost(Double.POSITIVE_INFINITY)
                .confidence(0)
                .errorCode(code)
                .error(error)
                .build();
    }
}

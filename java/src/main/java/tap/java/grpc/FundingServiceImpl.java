package tap.java.grpc;

import io.grpc.Status;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tap.core.clock.Clock;
import tap.core.error.ErrorCode;
import tap.core.model.FundingOutcome;
import tap.core.model.FundingRequest;
import tap.core.model.RejectionReason;
import tap.java.pipeline.Eligibility;
import tap.java.pipeline.FundingTicket;
import tap.java.pipeline.PipelineCoordinator;
import tap.proto.EligibilityResponse;
import tap.proto.FaucetServiceGrpc;
import tap.proto.FundRequest;
import tap.proto.FundResponse;
import tap.proto.HealthCheckRequest;
import tap.proto.HealthCheckResponse;
import tap.proto.Rejection;

/**
 * gRPC front end over {@link PipelineCoordinator}.
 *
 * <p>This is a thin wrapper with:
 * <ul>
 *   <li>Request validation (fail-fast with INVALID_ARGUMENT)</li>
 *   <li>Error handling (INTERNAL for unexpected errors)</li>
 *   <li>Protobuf conversion (FundingOutcome → FundResponse)</li>
 *   <li>Client cancellation forwarded to the request's ticket; it only takes
 *       effect before funding starts</li>
 * </ul>
 *
 * <p>Fund runs on the coordinator's workers, not on the gRPC thread.
 */
public final class FundingServiceImpl extends FaucetServiceGrpc.FaucetServiceImplBase {
    private static final Logger log = LoggerFactory.getLogger(FundingServiceImpl.class);

    private final PipelineCoordinator coordinator;
    private final Clock clock;

    public FundingServiceImpl(PipelineCoordinator coordinator, Clock clock) {
        if (coordinator == null) {
            throw new IllegalArgumentException("coordinator cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.coordinator = coordinator;
        this.clock = clock;
    }

    @Override
    public void fund(FundRequest request, StreamObserver<FundResponse> responseObserver) {
        try {
            FundingRequest fundingRequest = toFundingRequest(request, responseObserver);
            if (fundingRequest == null) {
                return;
            }

            FundingTicket ticket = coordinator.submit(fundingRequest);
            ServerCallStreamObserver<FundResponse> call = null;
            if (responseObserver instanceof ServerCallStreamObserver<FundResponse> serverCall) {
                call = serverCall;
                call.setOnCancelHandler(() -> {
                    if (ticket.cancel()) {
                        log.debug("Request {} cancelled by client", ticket.requestId());
                    }
                });
            }

            ServerCallStreamObserver<FundResponse> finalCall = call;
            ticket.outcome().whenComplete((outcome, error) -> {
                if (finalCall != null && finalCall.isCancelled()) {
                    return;
                }
                if (error != null) {
                    responseObserver.onError(Status.INTERNAL
                        .withDescription("Internal error: " + error.getMessage())
                        .withCause(error)
                        .asRuntimeException());
                    return;
                }
                responseObserver.onNext(toResponse(outcome));
                responseObserver.onCompleted();
            });

        } catch (IllegalArgumentException e) {
            responseObserver.onError(Status.INVALID_ARGUMENT
                .withDescription(e.getMessage())
                .withCause(e)
                .asRuntimeException());
        } catch (Exception e) {
            log.error("Fund failed unexpectedly", e);
            responseObserver.onError(Status.INTERNAL
                .withDescription("Internal error: " + e.getMessage())
                .withCause(e)
                .asRuntimeException());
        }
    }

    @Override
    public void checkEligibility(FundRequest request, StreamObserver<EligibilityResponse> responseObserver) {
        try {
            FundingRequest fundingRequest = toFundingRequest(request, responseObserver);
            if (fundingRequest == null) {
                return;
            }

            Eligibility eligibility = coordinator.checkEligibility(fundingRequest);
            EligibilityResponse.Builder response = EligibilityResponse.newBuilder()
                .setEligible(eligibility.eligible())
                .setBypassed(eligibility.bypassed());
            if (eligibility.reason() != null) {
                response.setRejection(toRejection(eligibility.reason()));
            }

            responseObserver.onNext(response.build());
            responseObserver.onCompleted();

        } catch (IllegalArgumentException e) {
            responseObserver.onError(Status.INVALID_ARGUMENT
                .withDescription(e.getMessage())
                .withCause(e)
                .asRuntimeException());
        } catch (Exception e) {
            log.error("CheckEligibility failed unexpectedly", e);
            responseObserver.onError(Status.INTERNAL
                .withDescription("Internal error: " + e.getMessage())
                .withCause(e)
                .asRuntimeException());
        }
    }

    @Override
    public void healthCheck(HealthCheckRequest request, StreamObserver<HealthCheckResponse> responseObserver) {
        responseObserver.onNext(HealthCheckResponse.newBuilder()
            .setStatus(HealthCheckResponse.Status.SERVING)
            .build());
        responseObserver.onCompleted();
    }

    /**
     * @return the request, or null after reporting INVALID_ARGUMENT
     */
    private FundingRequest toFundingRequest(FundRequest request, StreamObserver<?> responseObserver) {
        // protobuf strings are never null, only empty
        if (request.getReceiver().isBlank()) {
            responseObserver.onError(Status.INVALID_ARGUMENT
                .withDescription(ErrorCode.INVALID_REQUEST.getCode() + ": receiver must not be empty")
                .asRuntimeException());
            return null;
        }
        if (request.getAmount() <= 0) {
            responseObserver.onError(Status.INVALID_ARGUMENT
                .withDescription(ErrorCode.INVALID_REQUEST.getCode() + ": amount must be > 0, got: " + request.getAmount())
                .asRuntimeException());
            return null;
        }

        String token = request.getAuthToken().isBlank() ? null : request.getAuthToken();
        return new FundingRequest(
            request.getReceiver().trim(),
            RemoteAddressInterceptor.currentSourceIp(),
            request.getAmount(),
            token,
            clock.nowNanos()
        );
    }

    static FundResponse toResponse(FundingOutcome outcome) {
        FundResponse.Builder builder = FundResponse.newBuilder()
            .setStatus(switch (outcome.status()) {
                case CONFIRMED -> FundResponse.Status.CONFIRMED;
                case REJECTED -> FundResponse.Status.REJECTED;
                case FAILED -> FundResponse.Status.FAILED;
                case TIMED_OUT -> FundResponse.Status.TIMED_OUT;
                case CANCELLED -> FundResponse.Status.CANCELLED;
            })
            .setAttempts(outcome.attempts().size())
            .setBypassed(outcome.bypassed());

        if (outcome.txnRef() != null) {
            builder.setTxnRef(outcome.txnRef());
        }
        if (outcome.rejection() != null) {
            builder.setRejection(toRejection(outcome.rejection()));
        }
        if (outcome.errorCode() != null) {
            builder.setErrorCode(outcome.errorCode().getCode());
        }
        if (outcome.detail() != null) {
            builder.setDetail(outcome.detail());
        }
        return builder.build();
    }

    private static Rejection toRejection(RejectionReason reason) {
        return Rejection.newBuilder()
            .setCode(reason.code().name())
            .setMessage(reason.message())
            .setRetryAfterNanos(reason.retryAfterNanos())
            .build();
    }
}

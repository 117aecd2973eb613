package io.admission.cli;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.MessageOrBuilder;
import com.google.protobuf.util.JsonFormat;
import io.admission.grpc.Empty;
import io.admission.grpc.SchedulerAdminGrpc;
import io.admission.grpc.TaskRequest;
import io.admission.grpc.TenantRequest;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;

import java.io.PrintStream;

public class AdminCli {
    public static void main(String[] args) throws InvalidProtocolBufferException {
        if (args.length == 0) { usage(System.out); return; }
        String host = System.getProperty("host", System.getenv().getOrDefault("ADMISSION_HOST", "127.0.0.1"));
        int port = Integer.parseInt(System.getProperty("port", System.getenv().getOrDefault("ADMISSION_PORT", "9090")));
        ManagedChannel ch = ManagedChannelBuilder.forAddress(host, port).usePlaintext().build();
        try {
            int code = run(SchedulerAdminGrpc.newBlockingStub(ch), args, System.out, System.err);
            if (code != 0) System.exit(code);
        } finally {
            ch.shutdownNow();
        }
    }

    static int run(SchedulerAdminGrpc.SchedulerAdminBlockingStub stub, String[] args, PrintStream out, PrintStream err)
            throws InvalidProtocolBufferException {
        switch (args[0]) {
            case "status" -> print(out, stub.getSystemStatus(Empty.getDefaultInstance()));
            case "stats" -> print(out, stub.getSchedulerStats(Empty.getDefaultInstance()));
            case "health" -> print(out, stub.health(Empty.getDefaultInstance()));
            case "tenant" -> {
                if (args.length < 2) { err.println("tenant requires a tenant id"); return 2; }
                print(out, stub.getTenantUsage(TenantRequest.newBuilder().setTenantId(args[1]).build()));
            }
            case "task" -> {
                if (args.length < 2) { err.println("task requires a task id"); return 2; }
                print(out, stub.getTask(TaskRequest.newBuilder().setTaskId(args[1]).build()));
            }
            case "cancel" -> {
                if (args.length < 2) { err.println("cancel requires a task id"); return 2; }
                print(out, stub.cancelTask(TaskRequest.newBuilder().setTaskId(args[1]).build()));
            }
            default -> {
                usage(err);
                return 2;
            }
        }
        return 0;
    }

    private static void print(PrintStream out, MessageOrBuilder message) throws InvalidProtocolBufferException {
        out.println(JsonFormat.printer().includingDefaultValueFields().omittingInsignificantWhitespace().print(message));
    }

    private static void usage(PrintStream out) {
        out.println("Usage: AdminCli <status|stats|health|tenant <id>|task <id>|cancel <id>>");
    }
}

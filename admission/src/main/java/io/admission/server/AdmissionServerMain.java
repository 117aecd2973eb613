package io.admission.server;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.admission.config.AdmissionConfig;
import io.admission.grpc.SchedulerAdminServer;
import io.admission.scheduler.FairScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class AdmissionServerMain {
    private static final Logger LOG = LoggerFactory.getLogger(AdmissionServerMain.class);

    public static void main(String[] args) throws Exception {
        AdmissionConfig cfg = AdmissionConfig.fromEnv();
        Injector injector = Guice.createInjector(new AdmissionModule(cfg));
        FairScheduler scheduler = injector.getInstance(FairScheduler.class);
        SchedulerAdminServer admin = injector.getInstance(SchedulerAdminServer.class);
        scheduler.start();
        admin.start();
        LOG.info("Admission server up: policy={}, workers={}, admin port={}", cfg.policy(), cfg.maxConcurrentTasks(), cfg.adminPort());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            admin.close();
            scheduler.close();
        }, "admission-shutdown"));
        // Keep running until stopped
        Thread.currentThread().join();
    }
}

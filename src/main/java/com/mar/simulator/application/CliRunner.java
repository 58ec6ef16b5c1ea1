package com.mar.simulator.application;

import lombok.extern.slf4j.Slf4j;
import java.util.Arrays;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import com.mar.simulator.config.AppProperties;
import com.mar.simulator.domain.model.SimulationResult;
import com.mar.simulator.engine.ProgressListener;
import com.mar.simulator.engine.SimulationException;
import com.mar.simulator.service.SimulationService;

@Slf4j
@Configuration
public class CliRunner {

    @Bean
    CommandLineRunner runner(SimulationService simulationService) {
        return args -> {
            if (args.length == 0) {
                // no command: serve the REST API only
                return;
            }
            String cmd = args[0];
            switch (cmd) {
                case "simulate" -> simulate(simulationService, args);
                default -> System.out.println("Usage: simulate [--data a.csv,b.csv] [--out dir]");
            }
        };
    }

    private static void simulate(SimulationService simulationService, String[] args) {
        AppProperties cfg = simulationService.resolveConfig(null);
        String data = getArg(args, "--data", null);
        if (data != null) {
            cfg.getData().setFiles(Arrays.stream(data.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList());
        }
        String out = getArg(args, "--out", null);
        if (out != null) {
            cfg.getOutput().setEnabled(true);
            cfg.getOutput().setDirectory(out);
        }
        try {
            SimulationResult result = simulationService.simulate(cfg, ProgressListener.NONE);
            var s = result.summary();
            System.out.printf("Ticks: %d | trades: %d (%d won, %d lost)%n",
                s.getTicks(), s.getTrades(), s.getWinningTrades(), s.getLosingTrades());
            System.out.printf("Gross: %.2f | net: %.2f | slippage: %.2f | transaction: %.2f%n",
                s.getGrossProfit(), s.getNetProfit(), s.getSlippageCost(), s.getTransactionCost());
            System.out.printf("Max margin: %.2f at %s | final equity: %.2f%n",
                s.getMaxMargin(), s.getMaxMarginTime(), s.getFinalEquity());
        } catch (SimulationException e) {
            log.error("Simulation failed [{}]: {}", e.getErrorCode(), e.getMessage());
            throw e;
        }
    }

    private static String getArg(String[] args, String key, String def) {
        for (int i = 0; i < args.length - 1; i++) {
            if (args[i].equals(key)) return args[i + 1];
        }
        return def;
    }
}

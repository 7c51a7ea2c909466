package icealbedo.physics.simulator;

import com.fasterxml.jackson.annotation.JsonIgnore;
import icealbedo.domain.climate.EquilibriumPoint;
import icealbedo.domain.simulation.Ensemble;
import icealbedo.domain.simulation.SummaryStatistics;
import icealbedo.domain.simulation.Trajectory;
import lombok.Builder;

import java.util.List;

/**
 * Resultado completo de una simulación orquestada por {@link ClimateSimulationRunner}.
 * Las trayectorias quedan en memoria; al serializar solo se exportan equilibrios y resumen.
 */
@Builder
public record ClimateReport(
        List<EquilibriumPoint> equilibria,
        @JsonIgnore Trajectory deterministicTrajectory,
        @JsonIgnore Ensemble ensemble,
        SummaryStatistics statistics,
        long seed
) {}

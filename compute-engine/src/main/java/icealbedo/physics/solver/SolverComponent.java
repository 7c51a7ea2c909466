package icealbedo.physics.solver;

/**
 * Contrato base para cualquier componente numérico del sistema.
 * Permite tratar a todos los solvers de forma polimórfica para tareas
 * de logging, identificación y depuración.
 */
public interface SolverComponent {
    /**
     * Nombre corto del algoritmo (ej: "RK4", "Euler-Maruyama").
     */
    String getName();

    /**
     * Descripción técnica detallada.
     */
    default String getDescription() {
        return "Sin descripción disponible.";
    }
}

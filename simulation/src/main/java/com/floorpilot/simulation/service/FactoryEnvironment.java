package com.floorpilot.simulation.service;

import com.floorpilot.shared.config.DowntimeModel;
import com.floorpilot.shared.config.FactoryConfig;
import com.floorpilot.shared.model.MachineStatus;
import com.floorpilot.simulation.model.DecisionState;
import com.floorpilot.simulation.model.FloorObservation;
import com.floorpilot.simulation.model.FloorSnapshot;
import com.floorpilot.simulation.model.IllegalActionReason;
import com.floorpilot.simulation.model.Machine;
import com.floorpilot.simulation.model.Operator;
import com.floorpilot.simulation.model.ProductionTarget;
import com.floorpilot.simulation.model.ShiftClock;
import com.floorpilot.simulation.model.StepInfo;
import com.floorpilot.simulation.model.StepResult;
import com.floorpilot.simulation.model.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Discrete-time simulation of one working day on the factory floor.
 *
 * <p>At every decision point one idle machine awaits an operator. The caller
 * answers with an action in {@code [0, operatorCount]}: {@code i < operatorCount}
 * binds operator {@code i}, {@code operatorCount} leaves the machine idle.
 * Actions that cannot be carried out are replaced by "leave idle" and
 * penalized; {@link #step(int)} never throws for a bad action.</p>
 *
 * <p>Between decisions all busy machines run in parallel in simulated time.
 * The clock jumps to the next unit completion or repair end, or by the idle
 * tick when nothing is running. When another idle machine can still be
 * staffed at the current instant, the next decision is offered without
 * advancing the clock. Completions are where stochastic events happen: each
 * finished unit is classified good or defective, then may trigger a
 * breakdown or a maintenance stop.</p>
 *
 * <p>All randomness comes from the instance's own {@link Random}, so a fixed
 * seed reproduces a run exactly. Not thread-safe: one driver per instance.</p>
 */
public class FactoryEnvironment {

    private static final Logger log = LoggerFactory.getLogger(FactoryEnvironment.class);

    private static final double TOLERANCE = 1e-4;
    private static final double MIN_ADVANCE = 1e-6;

    private final FactoryConfig config;
    private final StateEncoder encoder;
    private final RewardModel rewardModel;
    private final Random random;
    private final ShiftClock clock;
    private final ProductionTarget target;
    private final List<Machine> machines = new ArrayList<>();
    private final List<Operator> operators = new ArrayList<>();
    private final boolean[] offeredThisInstant;
    private final List<FloorSnapshot> history = new ArrayList<>();

    private int awaitingMachine = DecisionState.NO_MACHINE;
    private boolean terminal;
    private boolean recording;

    public FactoryEnvironment(FactoryConfig config, long seed) {
        this(config, new Random(seed));
    }

    public FactoryEnvironment(FactoryConfig config, Random random) {
        this.config = config;
        this.random = random;
        this.encoder = new StateEncoder(config);
        this.rewardModel = new RewardModel(config.rewardWeights());
        this.clock = new ShiftClock(config.dayLengthMinutes(), config.shiftCount());
        this.target = new ProductionTarget(config.dailyTarget());
        for (int m = 0; m < config.machineCount(); m++) {
            machines.add(new Machine(m, config.priority(m)));
        }
        for (int op = 0; op < config.operatorCount(); op++) {
            operators.add(new Operator(op, config.shiftCount()));
        }
        this.offeredThisInstant = new boolean[config.machineCount()];
        reset();
    }

    /**
     * Starts a new day: clock at zero, all machines idle, all operators free,
     * counters cleared. Consumes no randomness, so repeated calls without an
     * intervening step return equal states.
     */
    public DecisionState reset() {
        clock.reset();
        target.reset();
        machines.forEach(Machine::reset);
        operators.forEach(Operator::reset);
        Arrays.fill(offeredThisInstant, false);
        terminal = false;
        history.clear();
        awaitingMachine = nextAwaitingMachine();
        snapshot();
        log.debug("Floor reset: {} machines, {} operators, day of {} minutes",
            machines.size(), operators.size(), clock.dayLengthMinutes());
        return currentState();
    }

    /**
     * Resets and, when {@code recordHistory} is set, records a timeline of the episode.
     */
    public DecisionState reset(boolean recordHistory) {
        this.recording = recordHistory;
        return reset();
    }

    /**
     * Reseeds the random source, then resets.
     */
    public DecisionState reset(long seed) {
        random.setSeed(seed);
        return reset();
    }

    public StepResult step(int action) {
        if (terminal) {
            log.warn("step({}) called after the day ended; returning the terminal state", action);
            return new StepResult(currentState(), 0.0, true,
                info(DecisionState.NO_MACHINE, action, Operator.UNBOUND, IllegalActionReason.NONE,
                    false, new StepTally()));
        }

        int machineId = awaitingMachine;
        boolean eligibleAvailable = machineId != DecisionState.NO_MACHINE && hasEligibleOperator();
        IllegalActionReason reason = validate(action, machineId);

        boolean assigned = false;
        boolean highSkill = false;
        boolean switched = false;
        int assignedOperator = Operator.UNBOUND;
        if (!reason.isIllegal() && machineId != DecisionState.NO_MACHINE && action < config.operatorCount()) {
            Machine machine = machines.get(machineId);
            switched = machine.lastOperatorId() != Operator.UNBOUND && machine.lastOperatorId() != action;
            bind(machine, operators.get(action));
            assigned = true;
            assignedOperator = action;
            highSkill = encoder.isHighSkill(config.skill(action, machineId));
            snapshot();
        } else if (reason.isIllegal()) {
            log.debug("Action {} on machine {} substituted with idle: {}", action, machineId, reason);
        }
        if (machineId != DecisionState.NO_MACHINE) {
            offeredThisInstant[machineId] = true;
        }
        boolean idled = machineId != DecisionState.NO_MACHINE && !assigned && eligibleAvailable;

        StepTally tally = new StepTally();
        int next = nextAwaitingMachine();
        if (next != DecisionState.NO_MACHINE && hasEligibleOperator()) {
            awaitingMachine = next;
        } else {
            advance(tally);
            awaitingMachine = terminal ? DecisionState.NO_MACHINE : nextAwaitingMachine();
        }

        Transition transition = new Transition(assigned, highSkill, switched, reason.isIllegal(), idled,
            tally.good, tally.defective, tally.fatigue, terminal, target.goodParts(), target.dailyTarget(),
            tally.overCapacity, tally.lowSkillUnits, tally.halfway, tally.eightyPercent);
        double reward = rewardModel.reward(transition);

        if (terminal) {
            snapshot();
        }
        return new StepResult(currentState(), reward, terminal,
            info(machineId, action, assignedOperator, reason, idled, tally));
    }

    public DecisionState currentState() {
        return encoder.encode(observe());
    }

    public FloorObservation observe() {
        List<Boolean> free = new ArrayList<>(operators.size());
        for (Operator operator : operators) {
            free.add(operator.isFree());
        }
        List<MachineStatus> statuses = new ArrayList<>(machines.size());
        for (Machine machine : machines) {
            statuses.add(machine.status());
        }
        return new FloorObservation(awaitingMachine, clock.elapsedMinutes(), clock.shiftIndex(),
            target.goodParts(), free, statuses);
    }

    private IllegalActionReason validate(int action, int machineId) {
        if (action < 0 || action >= config.actionCount()) {
            return IllegalActionReason.OUT_OF_RANGE;
        }
        if (action == idleAction() || machineId == DecisionState.NO_MACHINE) {
            return IllegalActionReason.NONE;
        }
        Operator operator = operators.get(action);
        if (!operator.isFree()) {
            return IllegalActionReason.OPERATOR_BUSY;
        }
        if (!withinCapacity(operator)) {
            return IllegalActionReason.OPERATOR_OVER_CAPACITY;
        }
        return IllegalActionReason.NONE;
    }

    private void bind(Machine machine, Operator operator) {
        machine.assign(operator.id(), config.processTimeMinutes(operator.id(), machine.id()));
        operator.bind(machine.id());
    }

    private boolean withinCapacity(Operator operator) {
        int shift = clock.shiftIndex();
        return operator.busyMinutes(shift) < config.capacityMinutes(operator.id(), shift);
    }

    private boolean hasEligibleOperator() {
        return operators.stream().anyMatch(op -> op.isFree() && withinCapacity(op));
    }

    /**
     * Highest-priority idle machine not yet offered at this instant, ties by lowest id.
     */
    private int nextAwaitingMachine() {
        return machines.stream()
            .filter(m -> m.status().isAssignable() && !offeredThisInstant[m.id()])
            .min(Comparator.comparingInt((Machine m) -> -m.priority().level()).thenComparingInt(Machine::id))
            .map(Machine::id)
            .orElse(DecisionState.NO_MACHINE);
    }

    private void advance(StepTally tally) {
        double from = clock.elapsedMinutes();
        clock.advance(nextEventDelay());
        double now = clock.elapsedMinutes();

        double[] perShift = clock.minutesPerShift(from, now);
        for (Machine machine : machines) {
            if (machine.status() == MachineStatus.BUSY) {
                operators.get(machine.operatorId()).addBusyMinutes(perShift);
                machine.work(now - from);
            }
        }
        Arrays.fill(offeredThisInstant, false);

        for (Machine machine : machines) {
            MachineStatus before = machine.status();
            if (machine.advanceDowntime(now, TOLERANCE)) {
                log.debug("Machine {} {} -> {} at minute {}", machine.id(), before, machine.status(), now);
            }
        }

        boolean endOfDay = clock.isEndOfDay();
        for (Machine machine : machines) {
            if (!machine.isUnitComplete(TOLERANCE)) {
                continue;
            }
            if (endOfDay) {
                // unit finishing at closing time does not count
                operators.get(machine.release()).release();
            } else {
                completeUnit(machine, now, tally);
            }
        }

        if (endOfDay) {
            terminal = true;
            for (Machine machine : machines) {
                if (machine.status() == MachineStatus.BUSY) {
                    operators.get(machine.release()).release();
                }
            }
        }
    }

    private double nextEventDelay() {
        double now = clock.elapsedMinutes();
        double delay = Double.POSITIVE_INFINITY;
        boolean anyBusy = false;
        for (Machine machine : machines) {
            if (machine.status() == MachineStatus.BUSY) {
                anyBusy = true;
                delay = Math.min(delay, machine.remainingMinutes());
            } else if (machine.status().isDown()) {
                delay = Math.min(delay, machine.downUntilMinute() - now);
            }
        }
        if (!anyBusy) {
            delay = Math.min(delay, config.idleTickMinutes());
        }
        return Math.max(delay, MIN_ADVANCE);
    }

    /**
     * Single injection point for stochastic events: defect classification,
     * then breakdown, then maintenance.
     */
    private void completeUnit(Machine machine, double now, StepTally tally) {
        Operator operator = operators.get(machine.operatorId());
        int shift = clock.shiftEndingAt(now);
        tally.fatigue += fatigue(operator, shift);
        tally.overCapacity += overCapacityRatio(operator, shift);
        if (encoder.isLowSkill(config.skill(operator.id(), machine.id()))) {
            tally.lowSkillUnits++;
        }

        if (random.nextDouble() < config.defectProbability(operator.id(), machine.id())) {
            target.recordDefective();
            tally.defective++;
        } else {
            target.recordGood();
            tally.good++;
            tally.halfway |= target.passHalfway();
            tally.eightyPercent |= target.passEightyPercent();
        }
        snapshot();

        DowntimeModel breakdown = config.breakdown();
        DowntimeModel maintenance = config.maintenance();
        if (random.nextDouble() < breakdown.probability()) {
            double repair = breakdown.durationFor(random.nextDouble());
            double followUp = followUpMaintenance(repair);
            double brokenFor = maintenance.minMinutes() > 0.0 ? repair : repair - followUp;
            machine.breakDown(now, brokenFor, followUp);
            tally.breakdowns++;
            log.debug("Machine {} broke down at minute {}: {} minutes broken, {} in maintenance",
                machine.id(), now, brokenFor, followUp);
        } else if (random.nextDouble() < maintenance.probability()) {
            double duration = maintenance.durationFor(random.nextDouble());
            machine.startMaintenance(now, duration);
            tally.maintenanceStops++;
            log.debug("Machine {} stopped for maintenance at minute {} for {} minutes", machine.id(), now, duration);
        } else {
            machine.release();
        }
        operator.release();
    }

    /**
     * Maintenance that follows a repair: the maintenance model's minimum duration,
     * or the second half of the sampled repair time when that minimum is zero.
     */
    private double followUpMaintenance(double repairMinutes) {
        double minimum = config.maintenance().minMinutes();
        return minimum > 0.0 ? minimum : repairMinutes / 2.0;
    }

    /**
     * 0 below the fatigue threshold, rising linearly to 1 at full capacity.
     */
    private double fatigue(Operator operator, int shift) {
        double capacity = config.capacityMinutes(operator.id(), shift);
        if (capacity <= 0) {
            return 1.0;
        }
        double ratio = operator.busyMinutes(shift) / capacity;
        double threshold = config.fatigueThresholdRatio();
        if (ratio < threshold) {
            return 0.0;
        }
        return Math.min(1.0, (ratio - threshold) / (1.0 - threshold));
    }

    /**
     * How far past its shift capacity the operator has worked, as a fraction of that capacity.
     */
    private double overCapacityRatio(Operator operator, int shift) {
        double capacity = config.capacityMinutes(operator.id(), shift);
        double worked = operator.busyMinutes(shift);
        if (capacity <= 0 || worked <= capacity) {
            return 0.0;
        }
        return (worked - capacity) / capacity;
    }

    private StepInfo info(int machineId, int action, int assignedOperator, IllegalActionReason reason,
                          boolean idled, StepTally tally) {
        return new StepInfo(machineId, action, assignedOperator, reason, idled,
            clock.elapsedMinutes(), clock.shiftIndex(),
            tally.good, tally.defective, target.goodParts(), target.defectiveParts(),
            tally.breakdowns, tally.maintenanceStops);
    }

    private void snapshot() {
        if (!recording) {
            return;
        }
        List<Integer> machineOperators = new ArrayList<>(machines.size());
        List<Double> skills = new ArrayList<>(machines.size());
        List<MachineStatus> statuses = new ArrayList<>(machines.size());
        for (Machine machine : machines) {
            int op = machine.operatorId();
            machineOperators.add(op);
            skills.add(op == Operator.UNBOUND ? -1.0 : config.skill(op, machine.id()));
            statuses.add(machine.status());
        }
        history.add(new FloorSnapshot(clock.elapsedMinutes(), clock.shiftIndex(),
            machineOperators, skills, statuses, target.goodParts()));
    }

    public void stopRecording() {
        recording = false;
    }

    public List<FloorSnapshot> history() {
        return List.copyOf(history);
    }

    public int idleAction() {
        return config.operatorCount();
    }

    public int actionCount() {
        return config.actionCount();
    }

    public FactoryConfig config() {
        return config;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public int awaitingMachine() {
        return awaitingMachine;
    }

    public double elapsedMinutes() {
        return clock.elapsedMinutes();
    }

    public int shiftIndex() {
        return clock.shiftIndex();
    }

    public int goodParts() {
        return target.goodParts();
    }

    public int defectiveParts() {
        return target.defectiveParts();
    }

    public MachineStatus machineStatus(int machineId) {
        return machines.get(machineId).status();
    }

    public int machineOperator(int machineId) {
        return machines.get(machineId).operatorId();
    }

    public int operatorMachine(int operatorId) {
        return operators.get(operatorId).machineId();
    }

    public double operatorBusyMinutes(int operatorId, int shiftIndex) {
        return operators.get(operatorId).busyMinutes(shiftIndex);
    }

    private static final class StepTally {
        private int good;
        private int defective;
        private double fatigue;
        private int breakdowns;
        private int maintenanceStops;
        private double overCapacity;
        private int lowSkillUnits;
        private boolean halfway;
        private boolean eightyPercent;
    }
}

package org.argverify.logic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs programs through an in-process Z3. A fresh context is used per query.
 */
public class Z3SolverBackend implements SolverBackend {

    private static final Logger LOG = LoggerFactory.getLogger(Z3SolverBackend.class);

    @Override
    public SolverOutcome check(String program, long timeoutMillis) {
        LOG.debug("Checking SMT program ({} chars, timeout {} ms)", program.length(), timeoutMillis);
        try (Context ctx = new Context()) {
            // the parser only collects assertions; commands are run through the Solver API
            String declarations = program.replace("(check-sat)", "");
            BoolExpr[] assertions = ctx.parseSMTLIB2String(declarations, null, null, null, null);
            Solver solver = ctx.mkSolver();
            Params params = ctx.mkParams();
            params.add("timeout", (int) Math.min(Integer.MAX_VALUE, timeoutMillis));
            solver.setParameters(params);
            solver.add(assertions);
            Status status = solver.check();
            switch (status) {
                case UNSATISFIABLE:
                    return SolverOutcome.unsat();
                case SATISFIABLE:
                    return SolverOutcome.sat();
                default:
                    String reason = solver.getReasonUnknown();
                    LOG.warn("Z3 returned unknown: {}", reason);
                    return SolverOutcome.unknown(reason);
            }
        } catch (Z3Exception e) {
            LOG.warn("Z3 rejected program: {}", e.getMessage());
            return SolverOutcome.error(e.getMessage());
        } catch (UnsatisfiedLinkError e) {
            LOG.error("Z3 native library could not be loaded", e);
            return SolverOutcome.error("Z3 native library unavailable: " + e.getMessage());
        }
    }
}

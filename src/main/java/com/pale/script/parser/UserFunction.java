package com.pale.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.pale.debug.Debug;

/**
 * A function whose body is a parsed {@link Statement} over a fixed set of
 * parameter handles.
 *
 * The parameter Vars are shared by every call: arguments are written into
 * them as aliases before the body runs. A call made while another call of the
 * same function is still running overwrites the outer call's parameters.
 */
public final class UserFunction implements Callable {
    final String name;
    final List<Var> params;
    final Statement body;

    public UserFunction(String name, List<Var> params, Statement body) {
        if (body == null) throw new IllegalArgumentException("body must not be null");
        this.name = (name == null) ? "<anonymous>" : name;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.body = body;
    }

    public String name() { return name; }
    public int arity() { return params.size(); }

    @Override
    public Var call(List<Var> args, Location calledAt) {
        if (args.size() < params.size()) {
            throw new Diagnostics()
                    .error(calledAt, "Insufficient arguments provided!")
                    .note(null, name + " expects " + params.size() + " arguments, got " + args.size() + ".")
                    .toException();
        }
        if (args.size() > params.size()) {
            throw new Diagnostics()
                    .error(calledAt, "Too many arguments provided!")
                    .note(calledAt, "Delete them.")
                    .toException();
        }

        for (int i = 0; i < params.size(); i++) {
            params.get(i).set(Value.alias(args.get(i).newRef()));
        }

        // The body was memoized by any previous call.
        body.rearm();
        Debug.get().t("UserFunction", name + " called at " + calledAt);
        return body.resolve();
    }

    @Override
    public String toString() {
        return "UserFunction(" + name + "/" + params.size() + ")";
    }
}

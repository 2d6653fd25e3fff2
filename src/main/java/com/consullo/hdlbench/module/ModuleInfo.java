package com.consullo.hdlbench.module;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable description of one HDL module: name, parameters, ports and internal signals.
 *
 * <p>
 * Ports are kept in declaration order across directions; {@link #inputs()}, {@link #outputs()} and
 * {@link #inouts()} are ordered views over that list. No identifier appears twice across ports, wires and regs: the
 * {@link Builder} drops a repeated name and keeps the first occurrence.
 * </p>
 *
 * <p>An empty {@link #name()} means no module was found in the source.
 *
 * @since 1.0
 */
public final class ModuleInfo {

  private final String name;
  private final List<Parameter> parameters;
  private final List<Port> ports;
  private final List<Signal> wires;
  private final List<Signal> regs;

  private ModuleInfo(Builder b) {
    this.name = b.name;
    this.parameters = Collections.unmodifiableList(new ArrayList<>(b.parameters));
    this.ports = Collections.unmodifiableList(new ArrayList<>(b.ports));
    this.wires = Collections.unmodifiableList(new ArrayList<>(b.wires));
    this.regs = Collections.unmodifiableList(new ArrayList<>(b.regs));
  }

  public String name() {
    return name;
  }

  public boolean hasModule() {
    return !name.isEmpty();
  }

  public List<Parameter> parameters() {
    return parameters;
  }

  /**
   * Returns every port in declaration order.
   *
   * @return ports
   */
  public List<Port> ports() {
    return ports;
  }

  public List<Port> inputs() {
    return portsOf(PortDirection.INPUT);
  }

  public List<Port> outputs() {
    return portsOf(PortDirection.OUTPUT);
  }

  public List<Port> inouts() {
    return portsOf(PortDirection.INOUT);
  }

  public List<Signal> wires() {
    return wires;
  }

  public List<Signal> regs() {
    return regs;
  }

  private List<Port> portsOf(PortDirection direction) {
    return ports.stream()
        .filter(p -> p.direction() == direction)
        .collect(Collectors.toUnmodifiableList());
  }

  @Override
  public String toString() {
    return "ModuleInfo{name=" + name + ", parameters=" + parameters.size() + ", ports=" + ports.size()
        + ", wires=" + wires.size() + ", regs=" + regs.size() + "}";
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Collects declarations while enforcing the first-occurrence-wins rule.
   */
  public static final class Builder {

    private String name = "";
    private final List<Parameter> parameters = new ArrayList<>();
    private final List<Port> ports = new ArrayList<>();
    private final List<Signal> wires = new ArrayList<>();
    private final List<Signal> regs = new ArrayList<>();
    private final Set<String> parameterNames = new HashSet<>();
    private final Set<String> declaredNames = new HashSet<>();

    private Builder() {
    }

    public Builder name(String name) {
      this.name = name == null ? "" : name;
      return this;
    }

    /**
     * Adds a parameter unless one with the same name exists.
     *
     * @param parameter parameter
     * @return true if added
     */
    public boolean addParameter(Parameter parameter) {
      if (!parameterNames.add(parameter.name())) {
        return false;
      }
      parameters.add(parameter);
      return true;
    }

    /**
     * Adds a port unless the name is already declared as a port or internal signal.
     *
     * @param port port
     * @return true if added
     */
    public boolean addPort(Port port) {
      if (!declaredNames.add(port.name())) {
        return false;
      }
      ports.add(port);
      return true;
    }

    /**
     * Adds an internal signal unless the name is already declared.
     *
     * @param signal signal
     * @return true if added
     */
    public boolean addSignal(Signal signal) {
      if (!declaredNames.add(signal.name())) {
        return false;
      }
      if (signal.kind() == SignalKind.WIRE) {
        wires.add(signal);
      } else {
        regs.add(signal);
      }
      return true;
    }

    public boolean isDeclared(String identifier) {
      return declaredNames.contains(identifier);
    }

    public List<Parameter> parameters() {
      return Collections.unmodifiableList(parameters);
    }

    public ModuleInfo build() {
      return new ModuleInfo(this);
    }
  }
}

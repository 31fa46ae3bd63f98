/*
 * どこで: Casework サービス層
 * 何を: 状態遷移表 (許可される遷移と追加条件) を保持し、遷移の可否を判定する
 * なぜ: 状態の組み合わせを個別の if 文に散らさず、表として一か所で管理するため
 */
package com.casedesk.casework.service;

import com.casedesk.casework.api.InvalidTransitionException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/** 表に無い組み合わせ (自己遷移を含む) はすべて不正。 */
public final class LifecycleDefinition<S extends Enum<S>> {

  private final Class<S> stateType;
  private final Map<S, Map<S, TransitionRule>> transitions;

  private LifecycleDefinition(Class<S> stateType, Map<S, Map<S, TransitionRule>> transitions) {
    this.stateType = stateType;
    this.transitions = transitions;
  }

  public static <S extends Enum<S>> Builder<S> builder(Class<S> stateType) {
    return new Builder<>(stateType);
  }

  /**
   * @return 遷移に付随する条件
   * @throws InvalidTransitionException 表に無い遷移
   */
  public TransitionRule assertTransition(S from, S to) {
    final TransitionRule rule = transitions.getOrDefault(from, Map.of()).get(to);
    if (rule == null) {
      throw new InvalidTransitionException(from.name(), to.name());
    }
    return rule;
  }

  public boolean isAllowed(S from, S to) {
    return transitions.getOrDefault(from, Map.of()).containsKey(to);
  }

  public Set<S> targetsFrom(S from) {
    return Collections.unmodifiableSet(transitions.getOrDefault(from, Map.of()).keySet());
  }

  public boolean isTerminal(S state) {
    return transitions.getOrDefault(state, Map.of()).isEmpty();
  }

  public Class<S> stateType() {
    return stateType;
  }

  public static final class Builder<S extends Enum<S>> {

    private final Class<S> stateType;
    private final Map<S, Map<S, TransitionRule>> transitions;

    private Builder(Class<S> stateType) {
      this.stateType = stateType;
      this.transitions = new EnumMap<>(stateType);
    }

    public Builder<S> allow(S from, S to, TransitionRule rule) {
      if (from == to) {
        throw new IllegalArgumentException("self transition is not allowed: " + from);
      }
      transitions.computeIfAbsent(from, ignored -> new EnumMap<>(stateType)).put(to, rule);
      return this;
    }

    public LifecycleDefinition<S> build() {
      final Map<S, Map<S, TransitionRule>> frozen = new EnumMap<>(stateType);
      transitions.forEach(
          (from, targets) -> frozen.put(from, Collections.unmodifiableMap(new EnumMap<>(targets))));
      return new LifecycleDefinition<>(stateType, Collections.unmodifiableMap(frozen));
    }
  }
}

package com.casedesk.casework.service;

import com.casedesk.casework.model.CaseStatus;

/**
 * ケースの状態遷移表。RESOLVED と FILED は終端。PENDED から OPEN への復帰は再開スイープだけが行う。
 */
public final class CaseLifecycle {

  public static final LifecycleDefinition<CaseStatus> DEFINITION =
      LifecycleDefinition.builder(CaseStatus.class)
          .allow(CaseStatus.UNASSIGNED, CaseStatus.OPEN, TransitionRule.plain())
          .allow(CaseStatus.UNASSIGNED, CaseStatus.PENDED, TransitionRule.annotatedWithResumeAt())
          .allow(CaseStatus.UNASSIGNED, CaseStatus.RESOLVED, TransitionRule.annotated())
          .allow(CaseStatus.UNASSIGNED, CaseStatus.FILED, TransitionRule.annotated())
          .allow(CaseStatus.OPEN, CaseStatus.PENDED, TransitionRule.annotatedWithResumeAt())
          .allow(CaseStatus.OPEN, CaseStatus.RESOLVED, TransitionRule.annotated())
          .allow(CaseStatus.OPEN, CaseStatus.FILED, TransitionRule.annotated())
          .allow(CaseStatus.PENDED, CaseStatus.OPEN, TransitionRule.systemAction())
          .build();

  private CaseLifecycle() {}
}

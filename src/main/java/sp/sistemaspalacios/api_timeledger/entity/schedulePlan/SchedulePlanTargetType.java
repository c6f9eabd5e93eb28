package sp.sistemaspalacios.api_timeledger.entity.schedulePlan;

public enum SchedulePlanTargetType {
    WHOLE_DEPARTMENT(100),
    DEPARTMENT_EXCEPT(200),
    ONLY_EMPLOYEE(300);

    private final int specificity;

    SchedulePlanTargetType(int specificity) {
        this.specificity = specificity;
    }

    public int getSpecificity() {
        return specificity;
    }
}

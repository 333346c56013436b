package com.hrms.messaging.employee;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Employee summary returned by the employee service over the bus.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EmployeeInfo(
        String id,
        String firstName,
        String lastName,
        String email,
        String employeeNumber,
        String department,
        String position,
        String manager,
        String status,
        String hireDate
) {

    public String fullName() {
        return firstName + " " + lastName;
    }
}

package com.hrms.messaging.employee;

import com.hrms.messaging.rpc.CorrelatedRequestBridge;
import com.hrms.messaging.rpc.RpcException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Employee lookups for services without access to the employee database.
 *
 * Failed lookups degrade to "unknown employee": an empty list or an empty
 * {@link Optional}, never an exception.
 */
@Slf4j
public class EmployeeDirectoryClient {

    private final CorrelatedRequestBridge<EmployeeInfo> bridge;

    public EmployeeDirectoryClient(CorrelatedRequestBridge<EmployeeInfo> bridge) {
        this.bridge = bridge;
    }

    public CompletableFuture<List<EmployeeInfo>> getEmployees(Collection<String> employeeIds) {
        return bridge.request(employeeIds)
                .exceptionally(ex -> {
                    RpcException rpc = RpcException.unwrap(ex);
                    if (rpc != null) {
                        log.warn("Employee lookup failed ({}) for {} ids: {}",
                                rpc.getCode(), employeeIds.size(), rpc.getMessage());
                    } else {
                        log.error("Employee lookup failed for {} ids", employeeIds.size(), ex);
                    }
                    return List.of();
                });
    }

    public CompletableFuture<Optional<EmployeeInfo>> getEmployee(String employeeId) {
        return getEmployees(List.of(employeeId))
                .thenApply(employees -> employees.stream()
                        .filter(employee -> employeeId.equals(employee.id()))
                        .findFirst());
    }
}

package net.maasbridge.testutil;

/** Canned MAAS API payloads. */
public final class MaasFixtures {

    private MaasFixtures() {}

    public static String machineJson(String systemId, String hostname) {
        return """
                {
                  "system_id": "%s",
                  "hostname": "%s",
                  "fqdn": "%s.maas",
                  "status": 4,
                  "status_name": "Ready",
                  "architecture": "amd64/generic",
                  "cpu_count": 8,
                  "memory": 16384,
                  "power_state": "off",
                  "zone": {"id": 1, "name": "default"},
                  "pool": {"id": 0, "name": "default"},
                  "tag_names": ["virtual"],
                  "ip_addresses": ["10.0.0.5"],
                  "interface_set": [{"id": 7, "name": "eth0"}]
                }
                """.formatted(systemId, hostname, hostname);
    }

    public static String machineListJson(String... systemIds) {
        StringBuilder json = new StringBuilder("[");
        for (int i = 0; i < systemIds.length; i++) {
            if (i > 0) {
                json.append(',');
            }
            json.append(machineJson(systemIds[i], "host-" + systemIds[i]));
        }
        return json.append(']').toString();
    }

    public static String tagJson(String name) {
        return """
                {"name": "%s", "definition": "", "comment": "test tag", "kernel_opts": ""}
                """.formatted(name);
    }

    public static String zoneJson(int id, String name) {
        return """
                {"id": %d, "name": "%s", "description": "zone %s"}
                """.formatted(id, name, name);
    }
}

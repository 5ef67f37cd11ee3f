package org.javai.planning.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.javai.planning.api.AddedWaypoints;
import org.javai.planning.api.PlannerFunction;
import org.javai.planning.api.PlanningRequestAdapter;
import org.javai.planning.api.PlanningScene;
import org.javai.planning.model.ErrorCode;
import org.javai.planning.model.MotionPlanRequest;
import org.javai.planning.model.MotionPlanResponse;
import org.javai.planning.model.RobotState;
import org.javai.planning.model.RobotTrajectory;
import org.javai.planning.testsupport.FakePlanningScene;
import org.javai.planning.testsupport.RecordingAdapter;
import org.javai.planning.testsupport.RefusingAdapter;
import org.javai.planning.testsupport.TestRobots;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AdapterChainTest {

	private PlanningScene scene;
	private MotionPlanRequest request;
	private List<String> journal;
	private List<MotionPlanRequest> plannerSaw;
	private PlannerFunction planner;

	@BeforeEach
	void setUp() {
		scene = FakePlanningScene.empty(TestRobots.arm());
		request = TestRobots.request(TestRobots.state(0.0, 0.0), 1.0, 0.5);
		journal = new ArrayList<>();
		plannerSaw = new ArrayList<>();
		planner = (s, r, response) -> {
			journal.add("planner");
			plannerSaw.add(r);
			response.setTrajectory(RobotTrajectory.untimed(r.groupName(),
					List.of(r.startState(), TestRobots.state(1.0, 0.5))));
			return true;
		};
	}

	@Nested
	@DisplayName("Ordering")
	class Ordering {

		@Test
		@DisplayName("adapters see the request in configured order and the response in reverse")
		void preInOrderPostInReverse() {
			// Given
			AdapterChain chain = new AdapterChain(List.of(
					new RecordingAdapter("A", journal),
					new RecordingAdapter("B", journal),
					new RecordingAdapter("C", journal)));

			// When
			ChainResult result = chain.adaptAndPlan(planner, scene, request);

			// Then
			assertThat(result.success()).isTrue();
			assertThat(journal).containsExactly("A:pre", "B:pre", "C:pre", "planner", "C:post", "B:post", "A:post");
		}

		@Test
		@DisplayName("each adapter passes its transformed request downstream")
		void requestTransformationsAccumulate() {
			AdapterChain chain = new AdapterChain(List.of(
					new RecordingAdapter("A", journal),
					new RecordingAdapter("B", journal)));

			chain.adaptAndPlan(planner, scene, request);

			assertThat(plannerSaw).hasSize(1);
			assertThat(plannerSaw.get(0).parameters()).containsEntry(RecordingAdapter.TRAIL, "A/B");
			assertThat(request.parameters()).doesNotContainKey(RecordingAdapter.TRAIL);
		}

		@Test
		@DisplayName("the same adapter listed twice runs twice")
		void duplicatesAreKept() {
			RecordingAdapter twice = new RecordingAdapter("X", journal);
			AdapterChain chain = new AdapterChain(List.of(twice, twice));

			chain.adaptAndPlan(planner, scene, request);

			assertThat(journal).containsExactly("X:pre", "X:pre", "planner", "X:post", "X:post");
		}
	}

	@Nested
	@DisplayName("Empty chain")
	class EmptyChain {

		@Test
		@DisplayName("calls the planner function directly")
		void behavesLikeThePlannerFunction() {
			// Given
			MotionPlanResponse direct = new MotionPlanResponse();
			boolean directResult = planner.plan(scene, request, direct);
			plannerSaw.clear();

			// When
			ChainResult result = AdapterChain.empty().adaptAndPlan(planner, scene, request);

			// Then
			assertThat(result.success()).isEqualTo(directResult);
			assertThat(result.response().trajectory()).isEqualTo(direct.trajectory());
			assertThat(result.response().errorCode()).isEqualTo(direct.errorCode());
			assertThat(result.addedWaypointIndices()).isEmpty();
			assertThat(plannerSaw).containsExactly(request);
		}
	}

	@Nested
	@DisplayName("Short circuit")
	class ShortCircuit {

		@Test
		@DisplayName("an adapter that declines stops the chain and the planner is never called")
		void refusingAdapterStopsChain() {
			AdapterChain chain = new AdapterChain(List.of(
					new RecordingAdapter("A", journal),
					new RefusingAdapter(),
					new RecordingAdapter("C", journal)));

			ChainResult result = chain.adaptAndPlan(planner, scene, request);

			assertThat(result.success()).isFalse();
			assertThat(result.response().errorCode()).isEqualTo(ErrorCode.START_STATE_INVALID);
			assertThat(journal).containsExactly("A:pre", "A:post");
			assertThat(plannerSaw).isEmpty();
		}

		@Test
		@DisplayName("a declining planner function is reported as failure through every adapter")
		void plannerFailurePropagates() {
			PlannerFunction failing = (s, r, response) -> {
				response.fail(ErrorCode.PLANNING_FAILED, "no path");
				return false;
			};
			AdapterChain chain = new AdapterChain(List.of(new RecordingAdapter("A", journal)));

			ChainResult result = chain.adaptAndPlan(failing, scene, request);

			assertThat(result.success()).isFalse();
			assertThat(result.response().message()).isEqualTo("no path");
			assertThat(journal).containsExactly("A:pre", "A:post");
		}
	}

	@Nested
	@DisplayName("Per-call state")
	class PerCallState {

		@Test
		@DisplayName("added waypoints from one call do not leak into the next")
		void addedWaypointsAreFreshPerCall() {
			AtomicInteger calls = new AtomicInteger();
			PlanningRequestAdapter addsOnFirstCallOnly = new PlanningRequestAdapter() {
				@Override
				public String description() {
					return "FirstCallOnly";
				}

				@Override
				public boolean adaptAndPlan(PlannerFunction next, PlanningScene s, MotionPlanRequest r,
						MotionPlanResponse response, AddedWaypoints added) {
					boolean solved = next.plan(s, r, response);
					if (calls.getAndIncrement() == 0) {
						added.record(0);
					}
					return solved;
				}
			};
			AdapterChain chain = new AdapterChain(List.of(addsOnFirstCallOnly));

			ChainResult first = chain.adaptAndPlan(planner, scene, request);
			ChainResult second = chain.adaptAndPlan(planner, scene, request);

			assertThat(first.addedWaypointIndices()).containsExactly(0);
			assertThat(second.addedWaypointIndices()).isEmpty();
			assertThat(first.response()).isNotSameAs(second.response());
		}

		@Test
		void rejectsNullAdapters() {
			assertThatThrownBy(() -> new AdapterChain(Arrays.asList(new RefusingAdapter(), null)))
					.isInstanceOf(NullPointerException.class);
		}

		@Test
		void adapterListIsImmutable() {
			List<PlanningRequestAdapter> source = new ArrayList<>(List.of(new RefusingAdapter()));
			AdapterChain chain = new AdapterChain(source);
			source.clear();

			assertThat(chain.size()).isEqualTo(1);
			assertThatThrownBy(() -> chain.adapters().clear()).isInstanceOf(UnsupportedOperationException.class);
		}
	}

	@Nested
	@DisplayName("Merging added waypoints")
	class MergingAddedWaypoints {

		@Test
		void nothingAdded() {
			assertThat(AdapterChain.mergeAddedWaypoints(List.of(new AddedWaypoints(), new AddedWaypoints())))
					.isEmpty();
		}

		@Test
		@DisplayName("an inner insertion shifts outer indices at or after it")
		void innerInsertionShiftsOuterIndices() {
			// Given: the outer adapter added index 0, the inner one also index 0
			AddedWaypoints outer = added(0);
			AddedWaypoints inner = added(0);

			// When
			List<Integer> merged = AdapterChain.mergeAddedWaypoints(List.of(outer, inner));

			// Then
			assertThat(merged).containsExactly(0, 1);
		}

		@Test
		@DisplayName("indices before the inner insertion are left alone")
		void earlierIndicesUnchanged() {
			List<Integer> merged = AdapterChain.mergeAddedWaypoints(List.of(added(1, 5), added(3)));

			assertThat(merged).containsExactly(1, 3, 6);
		}

		@Test
		void resultIsSorted() {
			List<Integer> merged = AdapterChain.mergeAddedWaypoints(List.of(added(7), added(2), added(0)));

			assertThat(merged).containsExactly(0, 3, 9);
		}

		@Test
		@DisplayName("the chain reports merged indices of a prepend by each of two adapters")
		void chainMergesPrepends() {
			PlanningRequestAdapter prepend = new PlanningRequestAdapter() {
				@Override
				public String description() {
					return "Prepend";
				}

				@Override
				public boolean adaptAndPlan(PlannerFunction next, PlanningScene s, MotionPlanRequest r,
						MotionPlanResponse response, AddedWaypoints added) {
					boolean solved = next.plan(s, r, response);
					response.setTrajectory(response.trajectory().withPrefix(RobotState.empty()));
					added.record(0);
					return solved;
				}
			};
			AdapterChain chain = new AdapterChain(List.of(prepend, prepend));

			ChainResult result = chain.adaptAndPlan(planner, scene, request);

			assertThat(result.response().trajectory().waypointCount()).isEqualTo(4);
			assertThat(result.addedWaypointIndices()).containsExactly(0, 1);
		}

		private AddedWaypoints added(int... indices) {
			AddedWaypoints added = new AddedWaypoints();
			for (int index : indices) {
				added.record(index);
			}
			return added;
		}
	}
}
